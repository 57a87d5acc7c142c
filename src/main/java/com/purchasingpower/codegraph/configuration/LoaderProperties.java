package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class LoaderProperties {

    /** Rows per UNWIND write. */
    @Min(1)
    private int batchSize = 500;

    /** Delete every Entity node before the hierarchy phase. */
    private boolean clearBeforeLoad = false;
}
