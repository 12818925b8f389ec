package org.hcpdata.extractor.engagement.util;

import java.time.format.DateTimeFormatter;

public class Constants {
    public static final int DEFAULT_MONTHS_TO_RETAIN = 7;
    public static final String DEFAULT_OUTPUT_DIR = "outputs";
    public static final String MONTHS_TO_RETAIN_FILTER = "months_to_retain";
    public static final String PIPELINE_LOG_FILENAME = "pipeline.log";
    public static final String UNIFIED_OUTPUT_FILENAME = "hcp.csv";
    public static final String RECORD_COUNTER = "hcp.extractor.engagement.record.count";
    public static final DateTimeFormatter YRMO_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM");

    // Canonical channel and action vocabulary
    public static final String CALL_CHANNEL = "CALL";
    public static final String REACH_CHANNEL = "LMMR";
    public static final String DELIVERED = "Delivered";
    public static final String OPENED = "Opened";
    public static final String CLICKED = "Clicked";
}
