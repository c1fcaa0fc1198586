package io.strata.core.hot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Keeps each owner's hot items in {@code <owner>.hot.json}, so a later process picks up the
 * recent turns of an earlier one. Files are replaced atomically.
 */
public final class FileHotRepository implements HotRepository {
    private static final String SUFFIX = ".hot.json";

    private final Path directory;
    private final ObjectMapper mapper;

    public FileHotRepository(Path directory) {
        this.directory = directory;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized Optional<HotSnapshot> load(String ownerId) throws IOException {
        Path path = pathFor(ownerId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(Files.readString(path), HotSnapshot.class));
        } catch (IOException e) {
            throw new IOException("Unreadable hot snapshot " + path, e);
        }
    }

    @Override
    public synchronized void save(HotSnapshot snapshot) throws IOException {
        Files.createDirectories(directory);
        Path path = pathFor(snapshot.ownerId());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    @Override
    public synchronized List<String> owners() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<String> owners = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.map(path -> path.getFileName().toString())
                .filter(name -> name.endsWith(SUFFIX))
                .map(name -> URLDecoder.decode(name.substring(0, name.length() - SUFFIX.length()), StandardCharsets.UTF_8))
                .sorted()
                .forEach(owners::add);
        }
        return owners;
    }

    private Path pathFor(String ownerId) {
        return directory.resolve(URLEncoder.encode(ownerId, StandardCharsets.UTF_8) + SUFFIX);
    }
}
