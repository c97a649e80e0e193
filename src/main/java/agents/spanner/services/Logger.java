package agents.spanner.services;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.FileSystem;
import io.vertx.core.file.OpenOptions;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * CSV log sink for the whole process.
 *
 * Entries arrive on the {@code log} address as {@code message,level,class,category,subcategory};
 * the sink appends a receive sequence number and epoch millis and writes them in batches to
 * {@code <dataPath>/logs/current.csv}. Once a file has covered a day it is archived as
 * {@code yyyyMMdd_HHmm.csv} (UTC start of the day block) and only the newest archives are kept.
 * A request on {@code saveAllDataToFiles_OnTermination} forces a write and is answered once the
 * batch is on disk.
 */
public class Logger extends AbstractVerticle {

  static final String HEADER = "Message,Level,Class,Category,Subcategory,SequenceReceived,EpochTimeMillis\n";

  private static final long WRITE_EVERY_MS = 20_000;
  private static final long DAY_MS = 24 * 60 * 60 * 1000L;
  private static final int ARCHIVES_KEPT = 12;
  private static final String ARCHIVE_PATTERN = "\\d{8}_\\d{4}\\.csv";
  private static final DateTimeFormatter ARCHIVE_NAME =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmm").withZone(ZoneOffset.UTC);
  private static final OpenOptions APPEND = new OpenOptions().setAppend(true).setCreate(true);

  private final String logsDir;
  private final String currentFile;

  private final StringBuilder pending = new StringBuilder();
  private long received;
  private long blockStartedAt;

  public Logger(String dataPath) {
    this.logsDir = dataPath + "/logs";
    this.currentFile = logsDir + "/current.csv";
  }

  @Override
  public void start(Promise<Void> startPromise) {
    FileSystem fs = vertx.fileSystem();
    fs.mkdirs(logsDir)
        .compose(v -> fs.writeFile(currentFile, Buffer.buffer(HEADER)))
        .onSuccess(v -> {
          blockStartedAt = System.currentTimeMillis();

          vertx.eventBus().<String>consumer("log", msg -> append(msg.body()));
          vertx.eventBus().consumer("saveAllDataToFiles_OnTermination",
              msg -> write().onComplete(ar -> msg.reply("flushed")));
          vertx.setPeriodic(WRITE_EVERY_MS, id -> tick());

          vertx.eventBus().publish("logger.ready", "true");
        })
        .<Void>mapEmpty()
        .onComplete(startPromise);
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    write().onComplete(ar -> stopPromise.complete());
  }

  private void append(String entry) {
    received++;
    pending.append(entry).append(',').append(received).append(',')
        .append(System.currentTimeMillis()).append('\n');
  }

  private void tick() {
    long now = System.currentTimeMillis();
    if (now - blockStartedAt >= DAY_MS) {
      archive(now);
    } else {
      write();
    }
  }

  /**
   * Append everything received so far to the current file
   */
  Future<Void> write() {
    if (pending.length() == 0) {
      return Future.succeededFuture();
    }
    Buffer batch = Buffer.buffer(pending.toString());
    pending.setLength(0);

    return vertx.fileSystem().open(currentFile, APPEND)
        .compose(file -> file.write(batch).andThen(ar -> file.close()))
        .onFailure(e -> System.err.println("Logger: cannot write " + currentFile + ": " + e.getMessage()));
  }

  private Future<Void> archive(long now) {
    FileSystem fs = vertx.fileSystem();
    String archived = logsDir + "/" + ARCHIVE_NAME.format(Instant.ofEpochMilli(blockStartedAt)) + ".csv";

    // the pending batch still belongs to the block being archived
    return write()
        .compose(v -> fs.move(currentFile, archived))
        .compose(v -> {
          blockStartedAt = now;
          return fs.writeFile(currentFile, Buffer.buffer(HEADER));
        })
        .compose(v -> pruneArchives())
        .onFailure(e -> System.err.println("Logger: cannot archive " + currentFile + ": " + e.getMessage()));
  }

  private Future<Void> pruneArchives() {
    FileSystem fs = vertx.fileSystem();
    return fs.readDir(logsDir, ARCHIVE_PATTERN).compose(paths -> {
      List<String> archives = new ArrayList<>(paths);
      // names sort chronologically
      Collections.sort(archives);

      List<Future<Void>> deletions = new ArrayList<>();
      for (int i = 0; i < archives.size() - ARCHIVES_KEPT; i++) {
        deletions.add(fs.delete(archives.get(i)));
      }
      return Future.all(deletions).<Void>mapEmpty();
    });
  }
}
