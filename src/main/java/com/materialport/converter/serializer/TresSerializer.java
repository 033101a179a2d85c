package com.materialport.converter.serializer;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.materialport.converter.mapping.MappingTables;
import com.materialport.converter.model.MappedMaterial;
import com.materialport.converter.model.TextureBinding;
import com.materialport.converter.model.UniformValue;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import lombok.Value;

/**
 * Renders a {@link MappedMaterial} as a text {@code ShaderMaterial} resource.
 *
 * Output depends only on the material and the base paths. Parameters are
 * written grouped by kind (textures, booleans, floats, vectors, colors);
 * within a group, uniforms the family table declares come first in declared
 * order, the rest alphabetically.
 */
public class TresSerializer {
    private static final Logger log = LoggerFactory.getLogger(TresSerializer.class);

    static final String TEMPLATE_NAME = "shader_material.tres.ftl";
    static final String SHADER_RESOURCE_ID = "1";

    /** Texture slot -> toggle switched on when the slot is bound. */
    private static final Map<String, String> AUTO_ENABLE = new LinkedHashMap<>();
    static {
        AUTO_ENABLE.put("normal_texture", "enable_normal_texture");
        AUTO_ENABLE.put("leaf_normal", "enable_leaf_normal");
        AUTO_ENABLE.put("trunk_normal", "enable_trunk_normal");
        AUTO_ENABLE.put("emission_texture", "enable_emission_texture");
        AUTO_ENABLE.put("ao_texture", "enable_ambient_occlusion");
    }
    private static final String TRIPLANAR_PREFIX = "triplanar_texture_";
    private static final String TRIPLANAR_TOGGLE = "enable_triplanar_texture";

    private final Configuration freemarkerConfig;
    private final MappingTables tables;

    public TresSerializer() {
        this(MappingTables.defaults());
    }

    public TresSerializer(MappingTables tables) {
        this.tables = tables;
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String serialize(MappedMaterial material, String shaderBase, String textureBase) {
        List<ExtResource> resources = new ArrayList<>();
        resources.add(new ExtResource(SHADER_RESOURCE_ID, "Shader",
                joinPath(shaderBase, material.getFamily().getShaderFile())));

        Comparator<String> order = declaredOrder(material);
        List<ShaderParameter> parameters = new ArrayList<>();

        // Textures, one resource per distinct path
        Map<String, String> idsByPath = new HashMap<>();
        List<TextureBinding> textures = material.getTextures().values().stream()
                .sorted(Comparator.comparing(TextureBinding::getUniform, order))
                .toList();
        for (TextureBinding texture : textures) {
            String path = joinPath(textureBase, texture.getReferenceName());
            String id = idsByPath.get(path);
            if (id == null) {
                id = String.valueOf(resources.size() + 1);
                idsByPath.put(path, id);
                resources.add(new ExtResource(id, "Texture2D", path));
            }
            parameters.add(new ShaderParameter(texture.getUniform(), "ExtResource(\"" + id + "\")"));
        }

        Map<String, UniformValue> uniforms = withAutoEnabled(material);
        for (UniformValue.Type type : UniformValue.Type.values()) {
            uniforms.entrySet().stream()
                    .filter(e -> e.getValue().getType() == type)
                    .map(Map.Entry::getKey)
                    .sorted(order)
                    .forEach(name -> parameters.add(new ShaderParameter(name, format(uniforms.get(name)))));
        }

        Map<String, Object> model = new HashMap<>();
        model.put("loadSteps", resources.size() + 1);
        model.put("resources", resources);
        model.put("parameters", parameters);

        String text = render(model, material.getName());
        log.debug("Serialized {}: {} resources, {} parameters", material.getName(), resources.size(), parameters.size());
        return text;
    }

    private Map<String, UniformValue> withAutoEnabled(MappedMaterial material) {
        Map<String, UniformValue> uniforms = new LinkedHashMap<>(material.getUniforms());
        for (String slot : material.getTextures().keySet()) {
            String toggle = slot.startsWith(TRIPLANAR_PREFIX) ? TRIPLANAR_TOGGLE : AUTO_ENABLE.get(slot);
            if (toggle != null) {
                uniforms.putIfAbsent(toggle, UniformValue.ofBool(true));
            }
        }
        return uniforms;
    }

    private Comparator<String> declaredOrder(MappedMaterial material) {
        List<String> declared = tables.forFamily(material.getFamily()).getUniformOrder();
        return Comparator.<String>comparingInt(name -> {
            int index = declared.indexOf(name);
            return index < 0 ? Integer.MAX_VALUE : index;
        }).thenComparing(Comparator.naturalOrder());
    }

    private String render(Map<String, Object> model, String materialName) {
        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new IllegalStateException("Failed to render resource for " + materialName, e);
        }
    }

    static String format(UniformValue value) {
        return switch (value.getType()) {
            case BOOL -> String.valueOf(value.isBoolValue());
            case FLOAT -> NumberFormatUtil.formatFloat(value.getFloatValue());
            case VECTOR2 -> NumberFormatUtil.formatVector(value.getVector());
            case COLOR -> NumberFormatUtil.formatColor(value.getColor());
        };
    }

    static String joinPath(String base, String fileName) {
        String escaped = fileName.replace("\"", "\\\"");
        if (base == null || base.isEmpty()) {
            return escaped;
        }
        return (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + "/" + escaped;
    }

    @Value
    public static class ExtResource {
        String id;
        String type;
        String path;
    }

    @Value
    public static class ShaderParameter {
        String name;
        String value;
    }
}
