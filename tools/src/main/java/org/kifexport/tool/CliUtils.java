package org.kifexport.tool;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.Files.createDirectories;
import static java.nio.file.Files.newInputStream;
import static java.nio.file.Files.newOutputStream;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.zip.GZIPInputStream;

import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.kifexport.tool.export.TableSink;

import de.thetaphi.forbiddenapis.SuppressForbidden;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Utilities for command line scripts.
 */
public final class CliUtils {
    /**
     * Build a UTF-8 reader for a file, or for stdin if the file is -.
     *
     * @throws IOException if it is thrown opening the file
     */
    public static Reader reader(String file) throws IOException {
        return new InputStreamReader(inputStream(file), UTF_8);
    }

    /**
     * Get an input stream for a file. If the file looks like a gzip or bzip2
     * file then it is decompressed on the fly.
     *
     * @throws IOException if it is thrown opening the file
     */
    @SuppressFBWarnings(value = "PATH_TRAVERSAL_IN", justification = "coming from program arguments")
    public static InputStream inputStream(String file) throws IOException {
        if (file.equals("-")) {
            return ForbiddenOk.systemDotIn();
        }
        InputStream stream = new BufferedInputStream(newInputStream(Paths.get(file)));
        if (file.endsWith(".gz")) {
            stream = new GZIPInputStream(stream);
        } else if (file.endsWith(".bz2")) {
            stream = new BZip2CompressorInputStream(stream);
        }
        return stream;
    }

    /**
     * A sink writing each table to a file named after it in
     * {@code directory}. The directory is created, ala mkdir -p, when the
     * first table is opened.
     */
    @SuppressFBWarnings(value = "PATH_TRAVERSAL_OUT", justification = "coming from program arguments")
    public static TableSink directory(String directory) {
        Path root = Paths.get(directory);
        return table -> {
            createDirectories(root);
            return new OutputStreamWriter(new BufferedOutputStream(newOutputStream(root.resolve(table))), UTF_8);
        };
    }

    /**
     * Methods in this class are ignored by the forbiddenapis checks. Thus you
     * need to really really really be sure what you are putting in here is
     * right.
     */
    @SuppressForbidden
    public static final class ForbiddenOk {
        private ForbiddenOk() {
            // Utility class should never be instantiated
        }

        /**
         * Get System.in. CliTools should be allowed to use System.in/out/err.
         */
        public static InputStream systemDotIn() {
            return System.in;
        }

        /**
         * Get System.out. CliTools should be allowed to use System.in/out/err.
         */
        public static PrintStream systemDotOut() {
            return System.out;
        }

        /**
         * Get System.err. CliTools should be allowed to use System.in/out/err.
         */
        public static PrintStream systemDotErr() {
            return System.err;
        }
    }

    private CliUtils() {
        // Uncallable utility constructor
    }
}
