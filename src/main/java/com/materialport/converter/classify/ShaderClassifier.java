package com.materialport.converter.classify;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.materialport.converter.model.DecisionBasis;
import com.materialport.converter.model.MaterialRecord;
import com.materialport.converter.model.ShaderDecision;
import com.materialport.converter.model.ShaderReference;

/**
 * Decides which shader family a material belongs to. First match wins:
 * <ol>
 *   <li>a well-known, non-generic shader reference</li>
 *   <li>the most specific property signature</li>
 *   <li>keywords in the material name</li>
 *   <li>the generic opaque family</li>
 * </ol>
 * Holds no mutable state; the same input always yields the same decision.
 */
public class ShaderClassifier {
    private static final Logger log = LoggerFactory.getLogger(ShaderClassifier.class);

    private final FamilySignatures signatures;
    private final NameHeuristics nameHeuristics;

    public ShaderClassifier() {
        this(new FamilySignatures(), new NameHeuristics());
    }

    public ShaderClassifier(FamilySignatures signatures, NameHeuristics nameHeuristics) {
        this.signatures = signatures;
        this.nameHeuristics = nameHeuristics;
    }

    public ShaderDecision classify(MaterialRecord material) {
        ShaderReference shader = material.getShader();
        if (shader.isConclusive()) {
            return trace(material.getName(),
                    new ShaderDecision(shader.getFamily(), DecisionBasis.EXPLICIT_REFERENCE, shader.getShaderName()));
        }

        Optional<FamilySignatures.Match> match = signatures.bestMatch(material);
        if (match.isPresent()) {
            return trace(material.getName(), new ShaderDecision(match.get().getFamily(), DecisionBasis.SIGNATURE_MATCH,
                    String.join(",", match.get().getMatchedKeys())));
        }

        return classifyByName(material.getName());
    }

    /**
     * Classification for a material known only by name, e.g. one listed in a
     * manifest but absent from the archive.
     */
    public ShaderDecision classifyByName(String materialName) {
        return trace(materialName, nameHeuristics.score(materialName)
                .map(s -> new ShaderDecision(s.getFamily(), DecisionBasis.NAME_HEURISTIC, "score " + s.getPoints()))
                .orElseGet(ShaderDecision::fallback));
    }

    private static ShaderDecision trace(String name, ShaderDecision decision) {
        log.debug("Classified {} as {} ({})", name, decision.getFamily(), decision.getBasis());
        return decision;
    }
}
