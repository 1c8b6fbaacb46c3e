package com.structuredtables.parser;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

import com.structuredtables.parser.include.DefaultIncludeResolver;
import com.structuredtables.parser.include.IncludeResolver;

import lombok.Builder;
import lombok.Value;

/**
 * Settings for a {@link TermParser} and the parsers it spawns for includes.
 */
@Value
@Builder(toBuilder = true)
public class ParserConfig {

    /** Directory relative includes resolve against; defaults to the working directory. */
    @Builder.Default
    Path rootDirectory = Path.of("");

    @Builder.Default
    char delimiter = ',';

    @Builder.Default
    Charset charset = StandardCharsets.UTF_8;

    /** Lowercase term cells before parsing, so output keys are lowercase. */
    @Builder.Default
    boolean lowercaseTermNames = true;

    /**
     * Start include parsers from a copy of the includer's synonyms, value names
     * and parameter map instead of an empty state.
     */
    @Builder.Default
    boolean inheritIncludeState = false;

    @Builder.Default
    Duration httpConnectTimeout = Duration.ofSeconds(10);

    @Builder.Default
    Duration httpRequestTimeout = Duration.ofSeconds(30);

    /** Custom resolver; when null a {@link DefaultIncludeResolver} is built from the settings above. */
    IncludeResolver includeResolver;

    public static ParserConfig defaults() {
        return ParserConfig.builder().build();
    }

    public IncludeResolver resolver() {
        if (includeResolver != null) {
            return includeResolver;
        }
        return new DefaultIncludeResolver(delimiter, charset, httpConnectTimeout, httpRequestTimeout);
    }

    public ParserConfig withRootDirectory(Path directory) {
        return toBuilder().rootDirectory(directory).build();
    }
}
