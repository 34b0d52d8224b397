package ai.nda.redline.finding.clean;

import ai.nda.redline.finding.Finding;
import java.util.List;

/**
 * Rewrites reviewer citations into verbatim quotes of the document before matching.
 */
public interface CitationCleaner {

    List<Finding> clean(String documentText, List<Finding> findings);
}
