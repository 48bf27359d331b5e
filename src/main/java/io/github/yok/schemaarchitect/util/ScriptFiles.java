package io.github.yok.schemaarchitect.util;

import com.google.common.base.Preconditions;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;

/**
 * Reads and writes the text files the command line works on (SQL scripts, Markdown responses,
 * JSON samples). All files are UTF-8.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ScriptFiles {

    /**
     * Path argument that stands for standard input.
     */
    public static final String STDIN = "-";

    private ScriptFiles() {
        throw new AssertionError("ScriptFiles must not be instantiated.");
    }

    /**
     * Reads a whole file, or standard input when {@code path} is {@link #STDIN}.
     *
     * @param path file path or {@code -}
     * @return file content
     * @throws IOException if the file cannot be read
     * @throws NullPointerException if {@code path} is {@code null}
     */
    public static String read(String path) throws IOException {
        return read(path, System.in);
    }

    /**
     * Reads a whole file, or {@code stdin} when {@code path} is {@link #STDIN}.
     *
     * @param path file path or {@code -}
     * @param stdin stream used for {@code -}
     * @return file content
     * @throws IOException if the file or stream cannot be read
     */
    static String read(String path, InputStream stdin) throws IOException {
        Preconditions.checkNotNull(path, "path must not be null");
        if (STDIN.equals(path)) {
            return IOUtils.toString(stdin, StandardCharsets.UTF_8);
        }
        File file = new File(path);
        String content = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
        log.debug("Read {} character(s) from {}", content.length(), file.getAbsolutePath());
        return content;
    }

    /**
     * Writes {@code content} to {@code path}, creating parent directories as needed and replacing
     * an existing file.
     *
     * @param path target file path
     * @param content text to write
     * @throws IOException if the file cannot be written
     */
    public static void write(String path, String content) throws IOException {
        Preconditions.checkNotNull(path, "path must not be null");
        File file = new File(path);
        FileUtils.writeStringToFile(file, content, StandardCharsets.UTF_8);
        log.info("Wrote result: {}", file.getAbsolutePath());
    }
}
