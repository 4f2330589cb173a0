package com.ethicalai.scoring.service.fingerprint;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import org.springframework.stereotype.Service;

import com.ethicalai.scoring.dto.dataset.DatasetProfile;
import com.ethicalai.scoring.dto.fingerprint.Fingerprint;
import com.ethicalai.scoring.exception.DatasetLoadException;
import com.ethicalai.scoring.service.data_processing.DatasetSource;
import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.hash.HashingInputStream;
import com.google.common.io.ByteStreams;

import lombok.extern.slf4j.Slf4j;

/**
 * Content identity of a dataset: a SHA-256 digest streamed over the raw bytes plus the size and
 * the shape reported by the profiler.
 */
@Slf4j
@Service
public class FingerprintService {

  public static final String ALGORITHM = "SHA-256";

  private static final double BYTES_PER_MB = 1024.0 * 1024.0;

  private final HashFunction hashFunction = Hashing.sha256();

  public Fingerprint fingerprint(DatasetSource source, DatasetProfile profile) {
    try (InputStream in = source.getContent().openStream()) {
      return fingerprint(in, source.getName(), profile);
    } catch (IOException e) {
      throw new DatasetLoadException("Could not read dataset '" + source.getName() + "'", e);
    }
  }

  public Fingerprint fingerprint(byte[] content, String fileName, DatasetProfile profile) {
    return fingerprint(new ByteArrayInputStream(content), fileName, profile);
  }

  public Fingerprint fingerprint(Path path, DatasetProfile profile) {
    try (InputStream in = Files.newInputStream(path)) {
      return fingerprint(in, path.getFileName().toString(), profile);
    } catch (IOException e) {
      throw new DatasetLoadException("Could not read dataset '" + path + "'", e);
    }
  }

  /** Reads the stream to its end in one pass; the caller keeps ownership of the stream. */
  public Fingerprint fingerprint(InputStream in, String fileName, DatasetProfile profile) {
    Digest digest = digest(in, fileName);
    Fingerprint fingerprint =
        Fingerprint.builder()
            .fileHash(digest.hash.toString())
            .algorithm(ALGORITHM)
            .fileSizeBytes(digest.size)
            .fileSizeMb(Math.round(digest.size / BYTES_PER_MB * 100) / 100.0)
            .rows(profile.getRowCount())
            .columns(profile.getColumnCount())
            .fileName(fileName)
            .generatedAt(Instant.now())
            .build();
    log.info(
        "Fingerprinted {}: {}... ({} bytes)",
        fileName,
        fingerprint.getFileHash().substring(0, 12),
        digest.size);
    return fingerprint;
  }

  /** Whether the stream holds exactly the content the fingerprint was taken from. */
  public boolean verify(InputStream in, Fingerprint fingerprint) {
    Digest digest = digest(in, fingerprint.getFileName());
    boolean matches =
        digest.size == fingerprint.getFileSizeBytes()
            && digest.hash.equals(HashCode.fromString(fingerprint.getFileHash()));
    if (!matches) {
      log.warn("Content of {} does not match its fingerprint", fingerprint.getFileName());
    }
    return matches;
  }

  private Digest digest(InputStream in, String fileName) {
    try {
      HashingInputStream hashing = new HashingInputStream(hashFunction, in);
      long size = ByteStreams.exhaust(hashing);
      return new Digest(hashing.hash(), size);
    } catch (IOException e) {
      throw new DatasetLoadException("Could not read dataset '" + fileName + "'", e);
    }
  }

  private static final class Digest {
    private final HashCode hash;
    private final long size;

    private Digest(HashCode hash, long size) {
      this.hash = hash;
      this.size = size;
    }
  }
}
