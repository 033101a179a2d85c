package com.materialport.converter.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for UnityYamlParser.
 */
class UnityYamlParserTest {

    private final UnityYamlParser parser = new UnityYamlParser();

    @Test
    void testDocumentHeadersCarryClassAndFileId() {
        String yaml = """
                %YAML 1.1
                %TAG !u! tag:unity3d.com,2011:
                --- !u!21 &2100000
                Material:
                  m_Name: Stone
                --- !u!114 &-4523
                MonoBehaviour:
                  version: 7
                """;

        List<YamlDocument> docs = parser.parse(yaml);

        assertThat(docs).hasSize(2);
        assertThat(docs.get(0).getClassId()).isEqualTo("21");
        assertThat(docs.get(0).getFileId()).isEqualTo("2100000");
        assertThat(docs.get(0).getRoot().get("Material").flatMap(m -> m.text("m_Name"))).contains("Stone");
        assertThat(docs.get(1).getClassId()).isEqualTo("114");
        assertThat(docs.get(1).getFileId()).isEqualTo("-4523");
    }

    @Test
    void testCompactSequenceAtParentIndentation() {
        String yaml = """
                --- !u!21 &1
                Material:
                  m_Floats:
                  - _Smoothness: 0.5
                  - _Metallic: 0
                  m_Name: After
                """;

        YamlNode material = parser.parse(yaml).get(0).getRoot().get("Material").orElseThrow();

        List<YamlNode> floats = material.get("m_Floats").orElseThrow().items();
        assertThat(floats).hasSize(2);
        assertThat(floats.get(0).text("_Smoothness")).contains("0.5");
        assertThat(floats.get(1).text("_Metallic")).contains("0");
        assertThat(material.text("m_Name")).contains("After");
    }

    @Test
    void testNestedMappingInsideSequenceItem() {
        String yaml = """
                Material:
                  m_TexEnvs:
                  - _BaseMap:
                      m_Texture: {fileID: 2800000, guid: 0123456789abcdef0123456789abcdef, type: 3}
                      m_Scale: {x: 2, y: 3}
                  - _BumpMap:
                      m_Texture: {fileID: 0}
                """;

        YamlNode texEnvs = parser.parse(yaml).get(0).getRoot().get("Material").orElseThrow()
                .get("m_TexEnvs").orElseThrow();

        assertThat(texEnvs.items()).hasSize(2);
        YamlNode baseMap = texEnvs.items().get(0).get("_BaseMap").orElseThrow();
        assertThat(baseMap.get("m_Texture").flatMap(t -> t.text("guid")))
                .contains("0123456789abcdef0123456789abcdef");
        assertThat(baseMap.get("m_Scale").flatMap(s -> s.text("y"))).contains("3");
        assertThat(texEnvs.items().get(1).get("_BumpMap").flatMap(b -> b.get("m_Texture")).flatMap(t -> t.text("guid")))
                .isEmpty();
    }

    @Test
    void testFlowCollectionsAndQuotedScalars() {
        String yaml = """
                root:
                  list: [a, 'b, c', "d\\"e"]
                  map: {key: 'it''s', other: [1, 2]}
                  empty: {}
                """;

        YamlNode root = parser.parse(yaml).get(0).getRoot().get("root").orElseThrow();

        assertThat(root.get("list").orElseThrow().items())
                .extracting(n -> n.asText().orElse(null))
                .containsExactly("a", "b, c", "d\"e");
        assertThat(root.get("map").flatMap(m -> m.text("key"))).contains("it's");
        assertThat(root.get("map").flatMap(m -> m.get("other")).orElseThrow().items()).hasSize(2);
        assertThat(root.get("empty").orElseThrow().entries()).isEmpty();
    }

    @Test
    void testFlowMappingContinuedOnNextLine() {
        String yaml = """
                Material:
                  m_Shader: {fileID: 4800000, guid: 933532a4fcc9baf4fa0491de14d08ed7,
                    type: 3}
                  m_Name: Wrapped
                """;

        YamlNode material = parser.parse(yaml).get(0).getRoot().get("Material").orElseThrow();

        assertThat(material.get("m_Shader").flatMap(s -> s.text("type"))).contains("3");
        assertThat(material.text("m_Name")).contains("Wrapped");
    }

    @Test
    void testTagsAndAnchorsAreDropped() {
        String yaml = """
                data:
                  value: !!float 1.5
                  other: &anchor plain
                  tagged: !custom
                    inner: 1
                """;

        YamlNode data = parser.parse(yaml).get(0).getRoot().get("data").orElseThrow();

        assertThat(data.text("value")).contains("1.5");
        assertThat(data.text("other")).contains("plain");
        assertThat(data.get("tagged").flatMap(t -> t.text("inner"))).contains("1");
    }

    @Test
    void testDuplicateKeyKeepsLastValue() {
        String yaml = """
                Material:
                  m_Name: First
                  m_Name: Second
                """;

        YamlNode material = parser.parse(yaml).get(0).getRoot().get("Material").orElseThrow();

        assertThat(material.text("m_Name")).contains("Second");
    }

    @Test
    void testBlockScalarsAndComments() {
        String yaml = """
                # leading comment
                doc:
                  literal: |
                    line one
                    line two
                  folded: >
                    one
                    two
                  plain: value # trailing comment
                """;

        YamlNode doc = parser.parse(yaml).get(0).getRoot().get("doc").orElseThrow();

        assertThat(doc.text("literal")).contains("line one\nline two");
        assertThat(doc.text("folded")).contains("one two");
        assertThat(doc.text("plain")).contains("value");
    }

    @Test
    void testUnterminatedFlowMappingFails() {
        String yaml = """
                Material:
                  m_Shader: {fileID: 0, guid: abc
                """;

        assertThatThrownBy(() -> parser.parse(yaml))
                .isInstanceOf(MaterialParseException.class)
                .hasMessageContaining("Unterminated");
    }

    @Test
    void testLineWithoutKeyFails() {
        String yaml = """
                Material:
                  m_Name: Ok
                  this line has no separator
                """;

        assertThatThrownBy(() -> parser.parse(yaml))
                .isInstanceOfSatisfying(MaterialParseException.class, e -> assertThat(e.getLine()).isEqualTo(3));
    }

    @Test
    void testEmptySourceYieldsNoDocuments() {
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse("%YAML 1.1\n")).isEmpty();
    }
}
