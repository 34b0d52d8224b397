package ai.nda.redline.cli;

import ai.nda.redline.config.OutputVariant;
import picocli.CommandLine;

public class OutputVariantConverter implements CommandLine.ITypeConverter<OutputVariant> {

    @Override
    public OutputVariant convert(String value) {
        return OutputVariant.from(value);
    }
}
