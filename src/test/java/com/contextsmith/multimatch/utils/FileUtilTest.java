package com.contextsmith.multimatch.utils;

import com.google.common.io.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import static org.junit.Assert.*;

public class FileUtilTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void prefersFileOnDisk() throws IOException {
        File file = folder.newFile("patterns.txt");
        Files.asCharSink(file, StandardCharsets.UTF_8).write("only\n");
        assertEquals("only\n", FileUtil.findResourceAsCharSource(file.getPath()).read());
    }

    @Test
    public void fallsBackToClasspath() throws IOException {
        String content = FileUtil.findResourceAsCharSource("ushers.txt").read();
        assertEquals("ushers", content.trim());
    }

    @Test
    public void decompressesGzip() throws IOException {
        assertEquals(FileUtil.findResourceAsCharSource("patterns.txt").read(),
                FileUtil.findResourceAsCharSource("patterns.txt.gz").read());
    }

    @Test
    public void missingResource() {
        assertNull(FileUtil.findResourceAsByteSource("no-such-file.txt"));
        try {
            FileUtil.findResourceAsCharSource("no-such-file.txt");
            fail("Expected IOException");
        } catch (IOException e) {
            assertTrue(e.getMessage().contains("no-such-file.txt"));
        }
    }

    @Test
    public void loadsProperties() throws IOException {
        Properties props = FileUtil.loadProperties("test-scan.properties");
        assertEquals("2", props.getProperty("patterns.min.chars"));
        assertTrue(FileUtil.loadProperties("no-such.properties").isEmpty());
    }

    @Test(expected = IOException.class)
    public void requiredPropertiesMustExist() throws IOException {
        FileUtil.loadProperties("no-such.properties", true);
    }

    @Test
    public void readsStreamsAsUtf8() throws IOException {
        byte[] bytes = "日本語".getBytes(StandardCharsets.UTF_8);
        assertEquals("日本語", FileUtil.inputStreamToCharSource(new ByteArrayInputStream(bytes)).read());
    }

    @Test(expected = IOException.class)
    public void fileAsCharSourceRequiresAFile() throws IOException {
        FileUtil.fileAsCharSource(folder.getRoot().getPath());
    }
}
