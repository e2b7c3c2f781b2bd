package com.scriptflow.blocks;

import com.scriptflow.models.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Detached copy of statements for copy/paste. Statements are immutable, so
 * holding them is enough; pasting assigns fresh identities.
 */
public class StatementClipboard {
    private final List<Statement> statements;
    private final String sourceLabel;
    private final long timestamp;

    public StatementClipboard(List<Statement> statements, String sourceLabel) {
        this.statements = statements != null
            ? Collections.unmodifiableList(new ArrayList<>(statements))
            : Collections.emptyList();
        this.sourceLabel = sourceLabel;
        this.timestamp = System.currentTimeMillis();
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public String getSourceLabel() {
        return sourceLabel;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
