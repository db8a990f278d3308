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
import io.github.yok.xmlcsvlink.parser.LexException;
import io.github.yok.xmlcsvlink.parser.TreeException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

class MarkupToTableConverterTest {

    @TempDir
    Path tempDir;

    private StatusNotifier notifier;
    private MarkupToTableConverter converter;

    @BeforeEach
    void setup() {
        notifier = mock(StatusNotifier.class);
        converter = new MarkupToTableConverter(new MarkupConfig(), new TableConfig(), notifier);
    }

    @Test
    void convert_正常ケース_マークアップファイルを指定する_表ファイルが書き出されること() throws Exception {
        Path input = tempDir.resolve("people.xml");
        Path output = tempDir.resolve("people.csv");
        Files.writeString(input, "<?xml version=\"1.0\"?>\n<people>\n"
                + "  <person><name>Alice</name><age>30</age></person>\n"
                + "  <person><name>Bob</name><age>25</age></person>\n</people>\n");

        ConversionResult result = converter.convert(input, output);

        assertTrue(result.isWritten());
        assertEquals("name,age\nAlice,30\nBob,25\n", result.getContent());
        assertEquals(result.getContent(), Files.readString(output));

        InOrder order = inOrder(notifier);
        order.verify(notifier).info("File read successfully");
        order.verify(notifier).info("Completed lexical analysis");
        order.verify(notifier).info("Completed parsing");
        order.verify(notifier).info("Completed CSV formatting");
        order.verify(notifier).info("CSV File written successfully");
        verify(notifier, never()).error(anyString());
    }

    @Test
    void convert_正常ケース_マルチバイト文字を含む_UTF8で読み書きされること() throws Exception {
        Path input = tempDir.resolve("ja.xml");
        Path output = tempDir.resolve("ja.csv");
        Files.writeString(input, "<一覧><行><名前>山田</名前></行></一覧>", StandardCharsets.UTF_8);

        converter.convert(input, output);

        assertEquals("名前\n山田\n", Files.readString(output, StandardCharsets.UTF_8));
    }

    @Test
    void convert_異常ケース_入力ファイルが存在しない_IOExceptionが送出されること() {
        Path input = tempDir.resolve("missing.xml");
        Path output = tempDir.resolve("out.csv");

        IOException ex = assertThrows(IOException.class, () -> converter.convert(input, output));

        assertTrue(ex.getMessage().startsWith("Could not open XML file " + input));
        assertFalse(Files.exists(output));
        verify(notifier, never()).info(anyString());
    }

    @Test
    void convert_異常ケース_字句エラー_LexExceptionが送出され出力されないこと() throws Exception {
        Path input = tempDir.resolve("bad.xml");
        Path output = tempDir.resolve("bad.csv");
        Files.writeString(input, "<a>x</a/>");

        LexException ex = assertThrows(LexException.class, () -> converter.convert(input, output));

        assertEquals("Unexpected '/' at line 1, column 8", ex.getMessage());
        assertFalse(Files.exists(output));
        verify(notifier).info("File read successfully");
        verify(notifier, never()).info("Completed lexical analysis");
    }

    @Test
    void convert_異常ケース_終了タグ不一致_TreeExceptionが送出されること() throws Exception {
        Path input = tempDir.resolve("mismatch.xml");
        Files.writeString(input, "<a><b></a></b>");

        TreeException ex = assertThrows(TreeException.class,
                () -> converter.convert(input, tempDir.resolve("mismatch.csv")));

        assertEquals("Unexpected closing tag. Found: a, Expected: b", ex.getMessage());
        verify(notifier).info("Completed lexical analysis");
    }

    @Test
    void convert_異常ケース_出力先がディレクトリ_エラー通知され未書き込みで返ること() throws Exception {
        Path input = tempDir.resolve("ok.xml");
        Files.writeString(input, "<r><p><x>1</x></p></r>");
        Path output = Files.createDirectory(tempDir.resolve("out"));

        ConversionResult result = converter.convert(input, output);

        assertFalse(result.isWritten());
        assertEquals("x\n1\n", result.getContent());
        verify(notifier).error(startsWith("Could not create CSV file: "));
        verify(notifier, never()).info("CSV File written successfully");
    }

    @Test
    void getFormat_正常ケース_変換方向が返ること() {
        assertEquals(DataFormat.XML, converter.getSourceFormat());
        assertEquals(DataFormat.CSV, converter.getTargetFormat());
    }
}
