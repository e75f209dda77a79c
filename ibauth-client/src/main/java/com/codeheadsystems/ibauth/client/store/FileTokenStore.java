package com.codeheadsystems.ibauth.client.store;

import com.codeheadsystems.ibauth.client.exceptions.TokenStoreException;
import com.codeheadsystems.ibauth.model.store.PersistedTokenRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TokenStore} backed by a JSON file readable and writable only by its owner.
 * <p>
 * Writes go to a temporary sibling created with owner-only permissions and are then moved over
 * the target, so the token file is never visible with broader permissions or half written.
 * A file that is not valid JSON is treated as absent; an I/O failure is not.
 */
@Singleton
public class FileTokenStore implements TokenStore {

  private static final Logger log = LoggerFactory.getLogger(FileTokenStore.class);

  static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

  private final Path path;
  private final ObjectMapper objectMapper;
  private final boolean posix;

  /**
   * Instantiates a new File token store.
   *
   * @param path         the token file
   * @param objectMapper the object mapper
   */
  @Inject
  public FileTokenStore(final Path path, final ObjectMapper objectMapper) {
    log.info("FileTokenStore(path={})", path);
    this.path = path;
    this.objectMapper = objectMapper;
    this.posix = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
  }

  @Override
  public synchronized Optional<PersistedTokenRecord> load() {
    if (!Files.exists(path)) {
      log.debug("load: no token file at {}", path);
      return Optional.empty();
    }
    try {
      PersistedTokenRecord record = objectMapper.readValue(Files.readString(path), PersistedTokenRecord.class);
      if (record == null || !record.isComplete()) {
        log.info("Token file {} is incomplete, ignoring it", path);
        return Optional.empty();
      }
      log.info("Loaded tokens from {}", path);
      return Optional.of(record);
    } catch (JsonProcessingException e) {
      log.warn("Token file {} is not valid JSON, ignoring it: {}", path, e.getOriginalMessage());
      return Optional.empty();
    } catch (IOException e) {
      throw new TokenStoreException("Unable to read token file " + path, e);
    }
  }

  @Override
  public synchronized void save(PersistedTokenRecord record) {
    Path directory = path.toAbsolutePath().getParent();
    Path temp = null;
    try {
      Files.createDirectories(directory);
      temp = posix
          ? Files.createTempFile(directory, ".ibauth", ".tmp", ownerOnly())
          : Files.createTempFile(directory, ".ibauth", ".tmp");
      restrict(temp);
      Files.writeString(temp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(record));
      Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      restrict(path);
      log.info("Saved tokens to {}", path);
    } catch (IOException e) {
      deleteQuietly(temp);
      throw new TokenStoreException("Unable to write token file " + path, e);
    }
  }

  @Override
  public synchronized void clear() {
    try {
      if (Files.deleteIfExists(path)) {
        log.info("Deleted token file {}", path);
      }
    } catch (IOException e) {
      throw new TokenStoreException("Unable to delete token file " + path, e);
    }
  }

  /**
   * The file this store writes.
   *
   * @return the path
   */
  public Path path() {
    return path;
  }

  private static FileAttribute<Set<PosixFilePermission>> ownerOnly() {
    return PosixFilePermissions.asFileAttribute(OWNER_ONLY);
  }

  private void restrict(Path file) throws IOException {
    if (posix) {
      Files.setPosixFilePermissions(file, OWNER_ONLY);
    } else {
      File f = file.toFile();
      boolean ok = f.setReadable(false, false) && f.setReadable(true, true)
          && f.setWritable(false, false) && f.setWritable(true, true);
      if (!ok) {
        throw new IOException("Unable to restrict permissions of " + file);
      }
    }
  }

  private static void deleteQuietly(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.warn("Unable to delete temporary token file {}", temp, e);
    }
  }
}
