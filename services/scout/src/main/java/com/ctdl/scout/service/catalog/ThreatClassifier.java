package com.ctdl.scout.service.catalog;

/**
 * Flags file types that are common malware carriers.
 */
public class ThreatClassifier {

    private final ExtensionCatalog threats;

    public ThreatClassifier(ExtensionCatalog threats) {
        this.threats = threats;
    }

    /**
     * @param fileType a bare extension such as {@code exe}; matched exactly
     */
    public boolean isHighThreat(String fileType) {
        return fileType != null && threats.contains(fileType);
    }
}
