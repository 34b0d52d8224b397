package ai.nda.redline.finding.clean;

import ai.nda.redline.finding.Finding;
import java.util.List;

/**
 * Cleaner used when no language model is configured; findings are returned unchanged.
 */
public class PassThroughCitationCleaner implements CitationCleaner {

    @Override
    public List<Finding> clean(String documentText, List<Finding> findings) {
        if (findings == null) {
            return List.of();
        }
        return List.copyOf(findings);
    }
}
