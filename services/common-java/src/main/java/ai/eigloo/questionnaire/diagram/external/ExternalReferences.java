package ai.eigloo.questionnaire.diagram.external;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Set-backed {@link ExternalReferenceOracle}.
 *
 * @param flags external flag names
 * @param numeric external numeric function names
 */
public record ExternalReferences(
        @JsonProperty("flags") Set<String> flags,
        @JsonProperty("numeric") Set<String> numeric
) implements ExternalReferenceOracle {

    static final ExternalReferences EMPTY = new ExternalReferences(Set.of(), Set.of());

    public ExternalReferences {
        flags = flags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(flags));
        numeric = numeric == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(numeric));
    }

    public static ExternalReferences empty() {
        return EMPTY;
    }

    @Override
    public boolean isFlagReference(String name) {
        return name != null && flags.contains(name);
    }

    @Override
    public boolean isNumericReference(String name) {
        return name != null && numeric.contains(name);
    }
}
