package com.structuredtables.parser.include;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structuredtables.parser.exception.UnresolvableIncludeException;
import com.structuredtables.parser.source.CsvRowSource;

/**
 * Opens local files relative to a root directory, and fetches {@code http(s)}
 * targets with {@link HttpClient}. Both are read as delimiter-separated rows.
 */
public class DefaultIncludeResolver implements IncludeResolver {
    private static final Logger log = LoggerFactory.getLogger(DefaultIncludeResolver.class);

    private final char delimiter;
    private final Charset charset;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    public DefaultIncludeResolver(char delimiter, Charset charset, Duration connectTimeout, Duration requestTimeout) {
        this.delimiter = delimiter;
        this.charset = charset;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public String locate(String target, Path rootDirectory) {
        if (isUrl(target)) {
            return target.trim();
        }
        return resolvePath(target, rootDirectory).toString();
    }

    @Override
    public IncludedSource open(String target, Path rootDirectory) {
        if (isUrl(target)) {
            return openUrl(target.trim(), rootDirectory);
        }
        return openFile(target, rootDirectory);
    }

    private IncludedSource openFile(String target, Path rootDirectory) {
        Path path = resolvePath(target, rootDirectory);

        if (!Files.isRegularFile(path)) {
            throw new UnresolvableIncludeException(target, "Included file not found: " + path);
        }

        try {
            log.info("Including file: {}", path);
            Path parent = path.getParent();
            return new IncludedSource(CsvRowSource.open(path, delimiter, charset),
                    parent != null ? parent : rootDirectory, path.toString());
        } catch (IOException e) {
            throw new UnresolvableIncludeException(target, "Failed to open included file " + path
                    + " (" + e.getMessage() + ")", e);
        }
    }

    private IncludedSource openUrl(String url, Path rootDirectory) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(requestTimeout)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            // bad syntax, or a scheme/host HttpClient cannot fetch (httpdocs/x.csv, http:foo)
            throw new UnresolvableIncludeException(url, "Malformed include URL: " + url, e);
        }

        try {
            log.info("Fetching include: {}", url);
            HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            if (response.statusCode() / 100 != 2) {
                response.body().close();
                throw new UnresolvableIncludeException(url,
                        "Fetching " + url + " failed with HTTP status " + response.statusCode());
            }
            // A URL has no local directory; nested relative includes keep the includer's root
            return new IncludedSource(CsvRowSource.open(url, response.body(), delimiter, charset), rootDirectory, url);
        } catch (IOException e) {
            throw new UnresolvableIncludeException(url, "Failed to fetch " + url + " (" + e.getMessage() + ")", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UnresolvableIncludeException(url, "Interrupted while fetching " + url, e);
        }
    }

    static boolean isUrl(String target) {
        return target != null && target.trim().startsWith("http");
    }

    static Path resolvePath(String target, Path rootDirectory) {
        String relative = target == null ? "" : target.trim();
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        Path base = rootDirectory != null ? rootDirectory : Path.of("");
        return base.resolve(relative).toAbsolutePath().normalize();
    }
}
