package me.christianrobert.cnxpretext.transformer.context;

import me.christianrobert.cnxpretext.config.service.ConfigService;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable snapshot of the converter settings used for one conversion.
 *
 * <p>Taken from {@link ConfigService} at the start of a conversion so that a
 * configuration change never affects a conversion already in progress.</p>
 */
public class ConversionOptions {

    public static final List<String> DEFAULT_MEDIA_PREFIXES = List.of("../../media/", "../media/");
    public static final String DEFAULT_MEDIA_TARGET_PREFIX = "media/";
    public static final int DEFAULT_PIXELS_PER_PERCENT = 5;
    public static final String DEFAULT_INDENT = "  ";
    public static final Set<String> DEFAULT_VARIABLE_NAMES =
            Set.of("X", "Y", "Z", "P", "Q", "x", "y", "z", "p", "q", "k", "n");

    private final List<String> mediaPrefixes;
    private final String mediaTargetPrefix;
    private final int pixelsPerPercent;
    private final String indentUnit;
    private final Set<String> variableNames;

    public ConversionOptions(List<String> mediaPrefixes,
                             String mediaTargetPrefix,
                             int pixelsPerPercent,
                             String indentUnit,
                             Set<String> variableNames) {
        if (pixelsPerPercent <= 0) {
            throw new IllegalArgumentException("pixelsPerPercent must be positive: " + pixelsPerPercent);
        }
        this.mediaPrefixes = List.copyOf(mediaPrefixes);
        this.mediaTargetPrefix = mediaTargetPrefix != null ? mediaTargetPrefix : "";
        this.pixelsPerPercent = pixelsPerPercent;
        this.indentUnit = indentUnit != null ? indentUnit : DEFAULT_INDENT;
        this.variableNames = Set.copyOf(variableNames);
    }

    public static ConversionOptions defaults() {
        return new ConversionOptions(DEFAULT_MEDIA_PREFIXES, DEFAULT_MEDIA_TARGET_PREFIX,
                DEFAULT_PIXELS_PER_PERCENT, DEFAULT_INDENT, DEFAULT_VARIABLE_NAMES);
    }

    /**
     * Reads the converter keys from the configuration, falling back to defaults for missing keys.
     */
    public static ConversionOptions fromConfig(ConfigService config) {
        List<String> prefixes = config.getConfigValueAsStringList(ConfigService.MEDIA_PREFIXES);
        String targetPrefix = config.getConfigValueAsString(ConfigService.MEDIA_TARGET_PREFIX);
        Integer ratio = config.getConfigValueAsInteger(ConfigService.PIXELS_PER_PERCENT);
        String indent = config.getConfigValueAsString(ConfigService.INDENT);
        List<String> variables = config.getConfigValueAsStringList(ConfigService.VARIABLE_NAMES);

        return new ConversionOptions(
                prefixes.isEmpty() ? DEFAULT_MEDIA_PREFIXES : prefixes,
                targetPrefix != null ? targetPrefix : DEFAULT_MEDIA_TARGET_PREFIX,
                ratio != null && ratio > 0 ? ratio : DEFAULT_PIXELS_PER_PERCENT,
                indent != null ? indent : DEFAULT_INDENT,
                variables.isEmpty() ? DEFAULT_VARIABLE_NAMES : new LinkedHashSet<>(variables));
    }

    public List<String> getMediaPrefixes() {
        return mediaPrefixes;
    }

    public String getMediaTargetPrefix() {
        return mediaTargetPrefix;
    }

    public int getPixelsPerPercent() {
        return pixelsPerPercent;
    }

    public String getIndentUnit() {
        return indentUnit;
    }

    public Set<String> getVariableNames() {
        return variableNames;
    }
}
