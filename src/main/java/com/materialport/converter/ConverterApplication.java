package com.materialport.converter;

import com.materialport.converter.cli.ConvertCommand;

import picocli.CommandLine;

/**
 * Main entry point for the material converter.
 * Reads a Unity package and writes its materials as ShaderMaterial resources.
 */
public class ConverterApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ConvertCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
