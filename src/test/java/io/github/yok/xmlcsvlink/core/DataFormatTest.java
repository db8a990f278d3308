package io.github.yok.xmlcsvlink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DataFormatTest {

    @Test
    void matches_正常ケース_大文字小文字を区別しないこと() {
        assertTrue(DataFormat.XML.matches("xml"));
        assertTrue(DataFormat.XML.matches("Xml"));
        assertTrue(DataFormat.CSV.matches("CSV"));
    }

    @Test
    void matches_異常ケース_他形式やnullを指定する_falseが返ること() {
        assertFalse(DataFormat.XML.matches("csv"));
        assertFalse(DataFormat.CSV.matches(""));
        assertFalse(DataFormat.CSV.matches(null));
    }

    @Test
    void getExtensions_正常ケース_小文字の拡張子が返ること() {
        assertEquals(Set.of("xml"), DataFormat.XML.getExtensions());
        assertEquals(Set.of("csv"), DataFormat.CSV.getExtensions());
    }
}
