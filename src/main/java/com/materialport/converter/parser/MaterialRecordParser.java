package com.materialport.converter.parser;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.materialport.converter.model.MaterialRecord;
import com.materialport.converter.model.RgbaColor;
import com.materialport.converter.model.ShaderReference;
import com.materialport.converter.model.TextureRef;
import com.materialport.converter.model.Vector2;

/**
 * Turns the bytes of one {@code .mat} file into a {@link MaterialRecord}.
 *
 * The Material document is the one tagged {@code !u!21} (or, failing that,
 * the one whose root key is {@code Material}). Properties are read from
 * {@code m_SavedProperties}: {@code m_TexEnvs} become texture slots,
 * {@code m_Floats} and {@code m_Ints} scalars, {@code m_Colors} colors.
 */
public class MaterialRecordParser {
    private static final Logger log = LoggerFactory.getLogger(MaterialRecordParser.class);

    static final String MATERIAL_CLASS_ID = "21";
    public static final double DEFAULT_COLOR_EPSILON = 1e-4;

    private final UnityYamlParser yamlParser = new UnityYamlParser();
    private final double colorEpsilon;
    private final Function<String, Optional<String>> pathnameLookup;

    public MaterialRecordParser() {
        this(DEFAULT_COLOR_EPSILON, identifier -> Optional.empty());
    }

    /**
     * @param colorEpsilon   how far outside [0, 1] a channel may drift and still be clamped
     * @param pathnameLookup archive pathname by identifier, used to name shaders shipped inside the package
     */
    public MaterialRecordParser(double colorEpsilon, Function<String, Optional<String>> pathnameLookup) {
        this.colorEpsilon = colorEpsilon;
        this.pathnameLookup = pathnameLookup;
    }

    public MaterialRecord parse(byte[] content, String sourcePath) {
        String text = new String(content, StandardCharsets.UTF_8);
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        return parse(text, sourcePath);
    }

    public MaterialRecord parse(String text, String sourcePath) {
        List<YamlDocument> documents;
        try {
            documents = yamlParser.parse(text);
        } catch (MaterialParseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MaterialParseException("Malformed material file: " + e.getMessage(), e);
        }

        YamlNode material = findMaterial(documents)
                .orElseThrow(() -> new MaterialParseException("No Material document found"));

        String name = material.text("m_Name")
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .orElseThrow(() -> new MaterialParseException("Material has no name"));

        MaterialRecord.MaterialRecordBuilder record = MaterialRecord.builder()
                .name(name)
                .sourcePath(sourcePath)
                .shader(resolveShader(material.get("m_Shader")));

        Optional<YamlNode> saved = material.get("m_SavedProperties");
        if (saved.isPresent()) {
            YamlNode properties = saved.get();
            properties.get("m_TexEnvs").ifPresent(node -> readTextures(node, record, name));
            properties.get("m_Floats").ifPresent(node -> readScalars(node, record, name));
            properties.get("m_Ints").ifPresent(node -> readScalars(node, record, name));
            properties.get("m_Colors").ifPresent(node -> readColors(node, record, name));
        } else {
            log.debug("Material {} has no saved properties", name);
        }

        MaterialRecord result = record.build();
        log.debug("Parsed material {}: {} textures, {} scalars, {} colors", name,
                result.getTextures().size(), result.getScalars().size(), result.getColors().size());
        return result;
    }

    private Optional<YamlNode> findMaterial(List<YamlDocument> documents) {
        for (YamlDocument document : documents) {
            if (MATERIAL_CLASS_ID.equals(document.getClassId())) {
                Optional<YamlNode> body = document.getRoot().get("Material");
                if (body.isPresent()) {
                    return body;
                }
            }
        }
        return documents.stream()
                .map(d -> d.getRoot().get("Material"))
                .flatMap(Optional::stream)
                .findFirst();
    }

    private ShaderReference resolveShader(Optional<YamlNode> reference) {
        String identifier = reference
                .flatMap(r -> r.text("guid"))
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .orElse("");
        if (isEmptyIdentifier(identifier)) {
            return ShaderReference.none();
        }

        Optional<KnownShader> known = KnownShaders.lookup(identifier);
        if (known.isPresent()) {
            KnownShader shader = known.get();
            return new ShaderReference(identifier, shader.getName(), shader.getFamily(), shader.isGeneric());
        }

        return pathnameLookup.apply(identifier)
                .map(path -> new ShaderReference(identifier, stem(path), null, false))
                .orElseGet(() -> ShaderReference.unresolved(identifier));
    }

    private void readTextures(YamlNode node, MaterialRecord.MaterialRecordBuilder record, String material) {
        for (Map.Entry<String, YamlNode> property : propertyEntries(node)) {
            YamlNode value = property.getValue();
            String identifier = value.get("m_Texture")
                    .flatMap(t -> t.text("guid"))
                    .map(s -> s.trim().toLowerCase(Locale.ROOT))
                    .orElse("");
            if (isEmptyIdentifier(identifier) || identifier.length() < 32) {
                continue;
            }
            Vector2 scale = readVector(value.get("m_Scale"), 1.0);
            Vector2 offset = readVector(value.get("m_Offset"), 0.0);
            record.texture(property.getKey(), new TextureRef(identifier, scale, offset));
            log.trace("{}: texture {} -> {}", material, property.getKey(), identifier);
        }
    }

    private void readScalars(YamlNode node, MaterialRecord.MaterialRecordBuilder record, String material) {
        for (Map.Entry<String, YamlNode> property : propertyEntries(node)) {
            Optional<Double> value = property.getValue().asText().flatMap(MaterialRecordParser::parseNumber);
            if (value.isPresent()) {
                record.scalar(property.getKey(), value.get());
            } else {
                log.debug("{}: ignoring non-numeric scalar {}", material, property.getKey());
            }
        }
    }

    private void readColors(YamlNode node, MaterialRecord.MaterialRecordBuilder record, String material) {
        for (Map.Entry<String, YamlNode> property : propertyEntries(node)) {
            YamlNode value = property.getValue();
            if (value.entries().isEmpty()) {
                log.debug("{}: ignoring malformed color {}", material, property.getKey());
                continue;
            }
            record.color(property.getKey(), new RgbaColor(
                    channel(value, "r", 0.0),
                    channel(value, "g", 0.0),
                    channel(value, "b", 0.0),
                    channel(value, "a", 1.0)));
        }
    }

    /**
     * Flattens the property list. Current files use a sequence of one-key
     * mappings; older ones use {@code first: {name: ...}} / {@code second:} pairs.
     */
    private static List<Map.Entry<String, YamlNode>> propertyEntries(YamlNode node) {
        List<Map.Entry<String, YamlNode>> entries = new ArrayList<>();
        List<YamlNode> items = node instanceof YamlNode.Sequence ? node.items() : List.of(node);

        for (YamlNode item : items) {
            Optional<String> legacyName = item.get("first").flatMap(f -> f.text("name"));
            Optional<YamlNode> legacyValue = item.get("second");
            if (legacyName.isPresent() && legacyValue.isPresent()) {
                entries.add(Map.entry(legacyName.get(), legacyValue.get()));
                continue;
            }
            entries.addAll(item.entries().entrySet());
        }
        return entries;
    }

    private double channel(YamlNode color, String key, double fallback) {
        double value = color.text(key).flatMap(MaterialRecordParser::parseNumber).orElse(fallback);
        if (value < 0.0 && value >= -colorEpsilon) {
            return 0.0;
        }
        if (value > 1.0 && value <= 1.0 + colorEpsilon) {
            return 1.0;
        }
        return value;
    }

    private static Vector2 readVector(Optional<YamlNode> node, double fallback) {
        if (node.isEmpty()) {
            return new Vector2(fallback, fallback);
        }
        double x = node.get().text("x").flatMap(MaterialRecordParser::parseNumber).orElse(fallback);
        double y = node.get().text("y").flatMap(MaterialRecordParser::parseNumber).orElse(fallback);
        // adding 0.0 turns -0.0 into 0.0
        return new Vector2(x + 0.0, y + 0.0);
    }

    static Optional<Double> parseNumber(String text) {
        String value = text.trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        try {
            double parsed = Double.parseDouble(value);
            return Double.isFinite(parsed) ? Optional.of(parsed) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static boolean isEmptyIdentifier(String identifier) {
        return identifier.isEmpty() || identifier.chars().allMatch(c -> c == '0');
    }

    private static String stem(String path) {
        String base = path.substring(Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\')) + 1);
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }
}
