package io.github.yok.xmlcsvlink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import io.github.yok.xmlcsvlink.config.MarkupConfig;
import io.github.yok.xmlcsvlink.config.TableConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

class TableToMarkupConverterTest {

    @TempDir
    Path tempDir;

    private StatusNotifier notifier;
    private TableToMarkupConverter converter;

    @BeforeEach
    void setup() {
        notifier = mock(StatusNotifier.class);
        converter = new TableToMarkupConverter(new MarkupConfig(), new TableConfig(), notifier);
    }

    @Test
    void convert_正常ケース_表ファイルを指定する_マークアップファイルが書き出されること() throws Exception {
        Path input = tempDir.resolve("people.csv");
        Path output = tempDir.resolve("people.xml");
        Files.writeString(input, "name,age\nAlice,30\n");

        ConversionResult result = converter.convert(input, output);

        String expected = "<?xml version=\"1.0\"?>\n<root2>\n  <element>\n    <name>Alice</name>\n"
                + "    <age>30</age>\n  </element>\n</root2>\n";
        assertTrue(result.isWritten());
        assertEquals(expected, result.getContent());
        assertEquals(expected, Files.readString(output));

        InOrder order = inOrder(notifier);
        order.verify(notifier).info("File read successfully");
        order.verify(notifier).info("Completed XML reverse parsing");
        order.verify(notifier).info("Completed XML formatting");
        order.verify(notifier).info("XML File written successfully");
        verify(notifier, never()).error(anyString());
    }

    @Test
    void convert_異常ケース_データ行がない_TableFormatExceptionが送出され出力されないこと()
            throws Exception {
        Path input = tempDir.resolve("header.csv");
        Path output = tempDir.resolve("header.xml");
        Files.writeString(input, "name,age\n");

        TableFormatException ex =
                assertThrows(TableFormatException.class, () -> converter.convert(input, output));

        assertEquals("No entries in CSV file", ex.getMessage());
        assertFalse(Files.exists(output));
    }

    @Test
    void convert_異常ケース_入力ファイルが存在しない_IOExceptionが送出されること() {
        Path input = tempDir.resolve("missing.csv");

        IOException ex = assertThrows(IOException.class,
                () -> converter.convert(input, tempDir.resolve("out.xml")));

        assertTrue(ex.getMessage().startsWith("Could not open CSV file " + input));
    }

    @Test
    void convert_異常ケース_出力先がディレクトリ_エラー通知され未書き込みで返ること() throws Exception {
        Path input = tempDir.resolve("ok.csv");
        Files.writeString(input, "a\n1\n");
        Path output = Files.createDirectory(tempDir.resolve("out"));

        ConversionResult result = converter.convert(input, output);

        assertFalse(result.isWritten());
        verify(notifier).error(startsWith("Could not create XML file: "));
    }

    @Test
    void getFormat_正常ケース_変換方向が返ること() {
        assertEquals(DataFormat.CSV, converter.getSourceFormat());
        assertEquals(DataFormat.XML, converter.getTargetFormat());
    }
}
