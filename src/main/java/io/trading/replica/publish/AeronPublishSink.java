package io.trading.replica.publish;

import io.aeron.Aeron;
import io.aeron.ExclusivePublication;
import io.aeron.driver.MediaDriver;
import io.aeron.driver.ThreadingMode;
import org.agrona.CloseHelper;
import org.agrona.ExpandableArrayBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Publishes book payloads on an Aeron IPC stream served by an embedded media driver.
 *
 * Message layout (native byte order):
 * <pre>
 * [symbol length: int32][symbol: UTF-8][payload bytes]
 * </pre>
 */
public class AeronPublishSink implements PublishSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(AeronPublishSink.class);
    private static final int BACKPRESSURE_LOG_INTERVAL = 1000;

    public static final int STREAM_ID = 2001;
    public static final String CHANNEL = "aeron:ipc?term-length=16m|alias=depth-replica-books";

    private final MediaDriver mediaDriver;
    private final Aeron aeron;
    private final ExclusivePublication publication;
    private final ExpandableArrayBuffer buffer = new ExpandableArrayBuffer(64 * 1024);
    private long publishFailures;

    public AeronPublishSink(String aeronDir) {
        String dir = resolveDirectory(aeronDir);

        MediaDriver.Context mediaDriverContext = new MediaDriver.Context()
            .aeronDirectoryName(dir)
            .threadingMode(ThreadingMode.SHARED)
            .dirDeleteOnStart(true);
        this.mediaDriver = MediaDriver.launchEmbedded(mediaDriverContext);
        LOGGER.info("Media driver started: dir={}", mediaDriver.aeronDirectoryName());

        Aeron.Context context = new Aeron.Context()
            .aeronDirectoryName(mediaDriver.aeronDirectoryName());
        this.aeron = Aeron.connect(context);

        LOGGER.info("Creating Aeron publication: channel={}, streamId={}", CHANNEL, STREAM_ID);
        this.publication = aeron.addExclusivePublication(CHANNEL, STREAM_ID);
    }

    /**
     * Falls back to a temp directory where /dev/shm is not available (e.g. macOS).
     */
    private static String resolveDirectory(String aeronDir) {
        String dir = aeronDir;
        if (dir.startsWith("/dev/shm") && !Files.exists(Paths.get("/dev/shm"))) {
            dir = System.getProperty("java.io.tmpdir") + "/" + Paths.get(aeronDir).getFileName();
            LOGGER.info("Using temp directory for Aeron: {}", dir);
        }
        try {
            Path dirPath = Paths.get(dir);
            if (!Files.exists(dirPath)) {
                Files.createDirectories(dirPath);
            }
        } catch (IOException e) {
            LOGGER.warn("Could not create Aeron directory: {}", dir, e);
        }
        return dir;
    }

    /**
     * Offers one framed payload. Only called from the dispatcher thread.
     */
    @Override
    public boolean publish(String symbol, byte[] payload) {
        int length = encode(buffer, symbol, payload);
        long result = publication.offer(buffer, 0, length);
        if (result < 0) {
            handleBackpressure(result);
            return false;
        }
        LOGGER.debug("[Aeron] {} payload published ({} bytes)", symbol, length);
        return true;
    }

    static int encode(ExpandableArrayBuffer target, String symbol, byte[] payload) {
        byte[] symbolBytes = symbol.getBytes(StandardCharsets.UTF_8);
        target.putInt(0, symbolBytes.length);
        target.putBytes(Integer.BYTES, symbolBytes);
        target.putBytes(Integer.BYTES + symbolBytes.length, payload);
        return Integer.BYTES + symbolBytes.length + payload.length;
    }

    private void handleBackpressure(long result) {
        publishFailures++;
        if (publishFailures % BACKPRESSURE_LOG_INTERVAL == 1) {
            LOGGER.warn("Aeron publication backpressure (count: {}, code: {})", publishFailures, result);
        }
    }

    @Override
    public void close() {
        CloseHelper.quietClose(publication);
        CloseHelper.close(aeron);
        CloseHelper.close(mediaDriver);
        LOGGER.info("Aeron sink closed");
    }
}
