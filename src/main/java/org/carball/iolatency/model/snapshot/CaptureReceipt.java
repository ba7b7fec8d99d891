package org.carball.iolatency.model.snapshot;

import java.time.LocalDateTime;

/**
 * Result of appending one snapshot round to the snapshot table.
 */
public record CaptureReceipt(LocalDateTime capturedAt, int rowsInserted) {}
