package com.alterante.relay.transfer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.BooleanSupplier;
import java.util.function.LongConsumer;

/**
 * Where the upload leg sends files. Blocking; called on the upload I/O thread.
 *
 * Failures follow the transport's taxonomy: {@code HttpProtocolException} when the server
 * refuses the file, {@code TransferCancelledException} when {@code cancelled} fired,
 * {@code NoSuchFileException} when the source is gone, any other {@link IOException} for
 * connectivity.
 */
@FunctionalInterface
public interface UploadTarget {

    /**
     * Upload one file under its logical name.
     *
     * @return the server's task id for the file
     */
    String upload(String name, Path file, LongConsumer onBytesSent, BooleanSupplier cancelled) throws IOException;
}
