package org.hcpdata.extractor.engagement.util;

import static org.hcpdata.extractor.engagement.util.Constants.MONTHS_TO_RETAIN_FILTER;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.hcpdata.extractor.engagement.config.EngagementProperties.SourceProperties;
import org.hcpdata.extractor.engagement.exception.InvalidConfigurationException;
import org.hcpdata.extractor.engagement.model.FieldPredicate;
import org.hcpdata.extractor.engagement.model.ParsedSourceConfig;
import org.hcpdata.extractor.engagement.model.RetentionWindowConfig;
import org.hcpdata.extractor.engagement.model.SourceFilterConfig;
import org.hcpdata.extractor.engagement.model.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SourceConfigParser resolves a source's configuration against the defaults and validates it.
 */
public class SourceConfigParser {

    private static final Logger logger = LoggerFactory.getLogger(SourceConfigParser.class);

    /**
     * Parse and validate the configuration of one source.
     *
     * <p>The {@code filters} map holds two kinds of entries:
     * {@code months_to_retain} sets the retention window (default from {@link DefaultArgs});
     * every other entry is an exact-match predicate on the raw field of the same name. Predicates
     * with a blank expected value are ignored. Without an explicit output location, the source
     * writes {@code <output-dir>/<source>.csv}.
     *
     * @param source        The source being configured.
     * @param properties    The source's configuration, possibly null.
     * @param outputDir     Directory for outputs without an explicit location.
     * @param referenceDate Date the run started, anchoring the retention window.
     * @return Resolved configuration.
     * @throws InvalidConfigurationException If required values are missing or invalid. All problems are reported together.
     */
    public static ParsedSourceConfig parse(SourceType source, SourceProperties properties, String outputDir, LocalDate referenceDate)
        throws InvalidConfigurationException {
        if (properties == null) {
            throw new InvalidConfigurationException(source, "No configuration for source " + source.getConfigKey());
        }
        List<String> messages = new ArrayList<>();

        if (StringUtils.isBlank(properties.getPath())) {
            messages.add("Missing required input: path");
        }

        Integer monthsToRetain = null;
        List<FieldPredicate> predicates = new ArrayList<>();
        for (Map.Entry<String, String> entry : properties.getFilters().entrySet()) {
            String field = entry.getKey();
            String value = StringUtils.trimToEmpty(entry.getValue());
            if (MONTHS_TO_RETAIN_FILTER.equals(field)) {
                monthsToRetain = parseMonthsToRetain(value, messages);
            } else if (value.isEmpty()) {
                logger.debug("{} - Ignoring filter on {} with no expected value", source.getConfigKey(), field);
            } else {
                predicates.add(new FieldPredicate(field, value));
            }
        }

        if (!messages.isEmpty()) {
            throw new InvalidConfigurationException(source,
                "Invalid configuration for source " + source.getConfigKey() + ": " + String.join("; ", messages));
        }

        String outputPath = StringUtils.isBlank(properties.getOutput())
            ? outputDir + "/" + source.getConfigKey() + ".csv"
            : properties.getOutput();
        RetentionWindowConfig retention = new RetentionWindowConfig(DefaultArgs.getMonthsToRetain(monthsToRetain), referenceDate);
        return new ParsedSourceConfig(source, properties.getPath(), outputPath, new SourceFilterConfig(predicates, retention));
    }

    private static Integer parseMonthsToRetain(String value, List<String> messages) {
        if (value.isEmpty()) {
            return null;
        }
        try {
            int months = Integer.parseInt(value);
            if (months < 0) {
                messages.add(MONTHS_TO_RETAIN_FILTER + " must not be negative: " + value);
                return null;
            }
            return months;
        } catch (NumberFormatException e) {
            messages.add(MONTHS_TO_RETAIN_FILTER + " is not a whole number: " + value);
            return null;
        }
    }
}
