package com.plcopen.generator.codegen.translate;

/**
 * An expected anchor element is missing from the skeleton document.
 */
public class AnchorNotFoundException extends Exception {

    private static final long serialVersionUID = 1L;
    private final String path;

    public AnchorNotFoundException(String path) {
        super("Anchor element not found: " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
