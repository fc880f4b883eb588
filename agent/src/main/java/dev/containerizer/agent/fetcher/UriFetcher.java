package dev.containerizer.agent.fetcher;

import dev.containerizer.agent.model.CommandSpec;
import dev.containerizer.agent.model.ContainerId;
import dev.containerizer.agent.model.FetchUri;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies local files and downloads {@code http}/{@code https} URIs into the sandbox. Files keep the last path
 * segment of their URI as name.
 */
public class UriFetcher implements Fetcher {

    private static final Logger logger = LoggerFactory.getLogger(UriFetcher.class);

    private final HttpClient http;
    private final ExecutorService executor;

    public UriFetcher(ExecutorService executor) {
        this(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build(), executor);
    }

    UriFetcher(HttpClient http, ExecutorService executor) {
        this.http = http;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Void> fetch(
            ContainerId containerId, CommandSpec command, Path directory, Optional<String> user) {
        if (command.uris().isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> {
            for (FetchUri uri : command.uris()) {
                var target = fetchOne(uri, directory);
                if (uri.executable() && !target.toFile().setExecutable(true)) {
                    throw new UncheckedIOException(new IOException("Failed to make " + target + " executable"));
                }
                user.ifPresent(name -> chown(target, name));
                logger.info("Fetched {} into {} for container {}", uri.value(), target, containerId);
            }
        }, executor);
    }

    private Path fetchOne(FetchUri uri, Path directory) {
        var source = URI.create(uri.value());
        var scheme = source.getScheme() == null ? "file" : source.getScheme();
        var target = directory.resolve(fileName(source));
        try {
            switch (scheme) {
                case "file" -> Files.copy(Path.of(source.getPath()), target, StandardCopyOption.REPLACE_EXISTING);
                case "http", "https" -> download(source, target);
                default -> throw new IOException("Unsupported URI scheme '" + scheme + "': " + uri.value());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to fetch " + uri.value(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UncheckedIOException(new IOException("Interrupted while fetching " + uri.value(), e));
        }
        return target;
    }

    private void download(URI source, Path target) throws IOException, InterruptedException {
        var response = http.send(HttpRequest.newBuilder(source).GET().build(), HttpResponse.BodyHandlers.ofInputStream());
        try (InputStream body = response.body()) {
            if (response.statusCode() / 100 != 2) {
                throw new IOException("HTTP " + response.statusCode() + " from " + source);
            }
            Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void chown(Path target, String user) {
        try {
            var lookup = target.getFileSystem().getUserPrincipalLookupService();
            Files.setOwner(target, lookup.lookupPrincipalByName(user));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to chown " + target + " to " + user, e);
        }
    }

    static String fileName(URI source) {
        var path = source.getPath();
        if (path == null || path.isEmpty() || path.endsWith("/")) {
            throw new IllegalArgumentException("Cannot derive a file name from " + source);
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
