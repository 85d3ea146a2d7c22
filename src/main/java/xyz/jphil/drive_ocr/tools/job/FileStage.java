package xyz.jphil.drive_ocr.tools.job;

/**
 * Pipeline stages of one input file, in order
 */
public enum FileStage {
    PREPARING("Preparing"),
    SPLITTING("Rendering pages"),
    EXTRACTING("OCR"),
    WRITING("Writing"),
    DONE("Done");

    private final String label;

    FileStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
