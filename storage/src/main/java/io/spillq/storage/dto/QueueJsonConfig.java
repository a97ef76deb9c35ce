package io.spillq.storage.dto;

import io.spillq.storage.SpillOrdering;

public class QueueJsonConfig {
    public String path;
    public Integer ringCapacity;
    public Integer maxRecordLength;
    public SpillOrdering ordering;
    public Boolean fsync;
    public Boolean flushOnClose;
}
