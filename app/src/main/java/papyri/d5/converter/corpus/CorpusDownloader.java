package papyri.d5.converter.corpus;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads the idp.data repository archive from GitHub and extracts the EpiDoc collections.
 */
public class CorpusDownloader {

    private static final Logger LOGGER = LoggerFactory.getLogger(CorpusDownloader.class);

    public static final URI ARCHIVE_URL = URI.create("https://github.com/papyri/idp.data/archive/refs/heads/master.zip");

    private final HttpClient httpClient;
    private final URI archiveUrl;

    public CorpusDownloader() {
        this(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build(), ARCHIVE_URL);
    }

    public CorpusDownloader(HttpClient httpClient, URI archiveUrl) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.archiveUrl = Objects.requireNonNull(archiveUrl, "archiveUrl");
    }

    /**
     * Replaces the local corpus copy with the current archive and drops the now stale TM index.
     */
    public void download(CorpusLayout layout) {
        Path dataRoot = layout.dataRoot();
        Path archive = dataRoot.resolve("temp.zip");
        try {
            Files.createDirectories(dataRoot);
            LOGGER.info("Downloading papyri.info data from {}", archiveUrl);
            HttpRequest request = HttpRequest.newBuilder(archiveUrl).GET().build();
            HttpResponse<Path> response = httpClient.send(request, HttpResponse.BodyHandlers.ofFile(archive));
            if (response.statusCode() != 200) {
                throw new CorpusException("Download failed. Status code: " + response.statusCode());
            }
            LOGGER.info("Extracting files to {}", dataRoot);
            int extracted = extract(archive, dataRoot);
            LOGGER.info("Extracted {} files", extracted);
            Files.deleteIfExists(layout.tmIndexPath());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CorpusException("Interrupted while downloading " + archiveUrl, ex);
        } catch (IOException ex) {
            throw new CorpusException("Failed to download " + archiveUrl, ex);
        } finally {
            deleteQuietly(archive);
        }
    }

    /**
     * Extracts the entries belonging to {@code DCLP} or {@code DDB_EpiDoc_XML}.
     *
     * @return the number of files written
     */
    static int extract(Path archive, Path target) throws IOException {
        Path root = target.toAbsolutePath().normalize();
        int extracted = 0;
        try (InputStream input = Files.newInputStream(archive); ZipInputStream zip = new ZipInputStream(input)) {
            for (ZipEntry entry = zip.getNextEntry(); entry != null; entry = zip.getNextEntry()) {
                String name = entry.getName();
                if (!name.contains(CorpusLayout.DCLP) && !name.contains(CorpusLayout.DDB)) {
                    continue;
                }
                Path destination = root.resolve(name).normalize();
                if (!destination.startsWith(root)) {
                    throw new IOException("Archive entry outside target directory: " + name);
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(destination);
                    continue;
                }
                Files.createDirectories(destination.getParent());
                Files.copy(zip, destination, StandardCopyOption.REPLACE_EXISTING);
                extracted++;
            }
        }
        return extracted;
    }

    private static void deleteQuietly(Path archive) {
        try {
            Files.deleteIfExists(archive);
        } catch (IOException ex) {
            LOGGER.warn("Could not delete temporary archive {}: {}", archive, ex.getMessage());
        }
    }
}
