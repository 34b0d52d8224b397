package ai.nda.redline.cli;

import ai.nda.redline.engine.MatchPolicy;
import picocli.CommandLine;

public class MatchPolicyConverter implements CommandLine.ITypeConverter<MatchPolicy> {

    @Override
    public MatchPolicy convert(String value) {
        if (value == null || value.isBlank()) {
            throw new CommandLine.TypeConversionException("Match policy must not be blank");
        }
        return MatchPolicy.from(value);
    }
}
