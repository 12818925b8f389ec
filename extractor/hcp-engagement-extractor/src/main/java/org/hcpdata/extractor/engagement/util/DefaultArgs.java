package org.hcpdata.extractor.engagement.util;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * DefaultArgs provides default values for per-source settings that a source's configuration leaves out.
 */
@Component
public class DefaultArgs {
    // Static so the static config parser can read them; preset for use outside a Spring context
    private static Integer monthsToRetain = Constants.DEFAULT_MONTHS_TO_RETAIN;
    private static String outputDir = Constants.DEFAULT_OUTPUT_DIR;

    /**
     * Months of data to retain when a source has no {@code months_to_retain} filter.
     *
     * @param monthsToRetain The configured default.
     */
    @Value("${hcp.defaults.months-to-retain:" + Constants.DEFAULT_MONTHS_TO_RETAIN + "}")
    public void setMonthsToRetain(Integer monthsToRetain) {
        DefaultArgs.monthsToRetain = monthsToRetain;
    }

    /**
     * Months of data to retain.
     *
     * @param input The value configured for a source, or null.
     * @return The input value or the default.
     */
    public static Integer getMonthsToRetain(Integer input) {
        return getValueOrDefault(input, monthsToRetain);
    }

    /**
     * Directory receiving outputs that have no explicit location.
     *
     * @param outputDir The configured output directory.
     */
    @Value("${hcp.output-dir:" + Constants.DEFAULT_OUTPUT_DIR + "}")
    public void setOutputDir(String outputDir) {
        DefaultArgs.outputDir = outputDir;
    }

    /**
     * Output directory.
     *
     * @param input The configured value, or null.
     * @return The input value or the default.
     */
    public static String getOutputDir(String input) {
        return getValueOrDefault(input, outputDir);
    }

    private static String getValueOrDefault(String value, String defaultValue) {
        return (value == null || value.isBlank()) ? defaultValue : value;
    }

    private static Integer getValueOrDefault(Integer value, Integer defaultValue) {
        return value == null ? defaultValue : value;
    }
}
