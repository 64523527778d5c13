package me.christianrobert.cnxpretext.transformer.parser;

import me.christianrobert.cnxpretext.transformer.model.SourceNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of parsing a CNXML document.
 * Contains the source tree and any well-formedness errors encountered.
 */
public class ParseResult {

    private final SourceNode tree;
    private final List<String> errors;
    private final String originalSource;

    public ParseResult(SourceNode tree, List<String> errors, String originalSource) {
        this.tree = tree;
        this.errors = new ArrayList<>(errors);
        this.originalSource = originalSource;
    }

    /**
     * Gets the root element of the parsed document, or null when parsing failed.
     */
    public SourceNode getTree() {
        return tree;
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public String getOriginalSource() {
        return originalSource;
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Gets a formatted error message combining all errors.
     */
    public String getErrorMessage() {
        if (errors.isEmpty()) {
            return null;
        }
        return String.join("\n", errors);
    }

    @Override
    public String toString() {
        return "ParseResult{success=" + isSuccess() + ", errors=" + errors.size() + "}";
    }
}
