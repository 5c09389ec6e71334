package docguard.core.port.out;

import docguard.core.model.pii.PiiDetection;

/**
 * Port interface for detecting and redacting personally identifying data in text.
 */
public interface PiiHandler {

    PiiDetection detectPii(String text);

    /**
     * Replace every detected value with a non-reversible placeholder.
     *
     * @param text the text
     * @return the redacted text; unchanged when nothing is detected
     */
    String sanitize(String text);
}
