package com.sky.association.catalog;

import com.sky.association.core.model.CatalogSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads catalogs from a directory. Catalogs without a registered format are read
 * from their normalized {@code <name>_psql.txt} file.
 */
public class FileCatalogSourceLoader implements CatalogSourceLoader {
    private static final Logger log = LoggerFactory.getLogger(FileCatalogSourceLoader.class);

    private final Path directory;
    private final CatalogRegistry registry;
    private final CatalogReader reader;
    private final Map<String, CatalogFormat> formats = new HashMap<>();

    public FileCatalogSourceLoader(Path directory, CatalogRegistry registry) {
        this.directory = directory;
        this.registry = registry;
        this.reader = new CatalogReader(registry);
    }

    /**
     * Registers a raw-file format for a catalog, used when no normalized file exists.
     */
    public FileCatalogSourceLoader withFormat(CatalogFormat format) {
        formats.put(format.getName().toLowerCase(Locale.ROOT), format);
        return this;
    }

    @Override
    public List<CatalogSource> load(String catalogName) {
        String name = registry.nameOf(registry.idOf(catalogName));
        CatalogFormat normalized = CatalogFormat.normalized(name);
        Path normalizedFile = directory.resolve(normalized.getFileName());
        CatalogFormat format = Files.isRegularFile(normalizedFile) || !formats.containsKey(name)
                ? normalized
                : formats.get(name);
        Path file = directory.resolve(format.getFileName());
        log.debug("Loading catalog {} from {}", name, file);
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return reader.read(in, format);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read catalog " + name + " from " + file, e);
        }
    }
}
