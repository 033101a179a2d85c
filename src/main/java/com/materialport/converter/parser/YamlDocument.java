package com.materialport.converter.parser;

import lombok.Value;

/**
 * One {@code --- !u!<classId> &<fileId>} section of a Unity YAML file.
 */
@Value
public class YamlDocument {
    String classId;
    String fileId;
    YamlNode root;
}
