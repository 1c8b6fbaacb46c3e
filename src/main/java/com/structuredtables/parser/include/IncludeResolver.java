package com.structuredtables.parser.include;

import java.nio.file.Path;

import com.structuredtables.parser.exception.UnresolvableIncludeException;

/**
 * Opens the target named by an {@code include} row.
 */
public interface IncludeResolver {

    /**
     * Resolve and open {@code target}.
     *
     * @param target        the include row's value; values starting with {@code http} are URLs
     * @param rootDirectory directory that relative targets resolve against
     * @throws UnresolvableIncludeException if the target cannot be opened
     */
    IncludedSource open(String target, Path rootDirectory);

    /**
     * Location a target resolves to, without opening it.
     */
    String locate(String target, Path rootDirectory);
}
