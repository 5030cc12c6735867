package com.toolport.catalog;

import java.time.Instant;

/** Registration bookkeeping. Never sent over the wire. */
public record ToolMeta(
    String module,
    String source,
    Instant dateAdded,
    Instant dateUpdated
) {}
