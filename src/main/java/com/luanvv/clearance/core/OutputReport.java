package com.luanvv.clearance.core;

import java.nio.file.Path;
import lombok.Value;

/**
 * Outcome of writing one product set. A target that was disabled counts as written.
 */
@Value
public class OutputReport {
    Path jsonPath;
    boolean jsonWritten;
    Path csvPath;
    boolean csvWritten;

    public boolean isComplete() {
        return jsonWritten && csvWritten;
    }
}
