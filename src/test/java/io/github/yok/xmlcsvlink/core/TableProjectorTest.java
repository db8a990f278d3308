package io.github.yok.xmlcsvlink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.xmlcsvlink.config.MarkupConfig;
import io.github.yok.xmlcsvlink.config.TableConfig;
import io.github.yok.xmlcsvlink.model.Node;
import io.github.yok.xmlcsvlink.parser.MarkupLexer;
import io.github.yok.xmlcsvlink.parser.TreeParser;
import org.junit.jupiter.api.Test;

class TableProjectorTest {

    private static Node parse(String xml) throws Exception {
        return new TreeParser(new MarkupConfig()).parse(new MarkupLexer().tokenize(xml));
    }

    @Test
    void project_正常ケース_繰り返し要素が2件ある_ヘッダと2行が文書順に出力されること() throws Exception {
        Node root = parse("<list><a><x>1</x><y>2</y></a><a><x>3</x><y>4</y></a></list>");

        String csv = new TableProjector(new TableConfig()).project(root);

        assertEquals("x,y\n1,2\n3,4\n", csv);
    }

    @Test
    void project_正常ケース_列の値が欠けている_空文字で行位置が揃えられること() throws Exception {
        Node root = parse("<r><p><x>1</x></p><p><y>2</y></p></r>");

        String csv = new TableProjector(new TableConfig()).project(root);

        // x has no value for the second row, so that row carries one field only
        assertEquals("x,y\n1,\n2\n", csv);
    }

    @Test
    void project_正常ケース_不足行の補完を有効にする_空フィールドで補完されること() throws Exception {
        Node root = parse("<r><p><x>1</x></p><p><y>2</y></p></r>");
        TableConfig config = new TableConfig();
        config.setPadRaggedRows(true);

        String csv = new TableProjector(config).project(root);

        assertEquals("x,y\n1,\n,2\n", csv);
    }

    @Test
    void project_正常ケース_同じ行で同じパスが重複する_後の値が採用されること() throws Exception {
        Node root = parse("<r><p><n>A</n><n>B</n></p></r>");

        String csv = new TableProjector(new TableConfig()).project(root);

        assertEquals("n\nB\n", csv);
    }

    @Test
    void project_正常ケース_空の葉要素を含む_列として扱われないこと() throws Exception {
        Node root = parse("<r><p><x></x><y>1</y></p></r>");

        String csv = new TableProjector(new TableConfig()).project(root);

        assertEquals("y\n1\n", csv);
    }

    @Test
    void project_正常ケース_親が異なる同名要素_別の列として出現順に出力されること() throws Exception {
        Node root = parse("<r><a><id>1</id></a><b><id>2</id></b></r>");

        String csv = new TableProjector(new TableConfig()).project(root);

        assertEquals("id,id\n1,\n2\n", csv);
    }

    @Test
    void project_正常ケース_要素がない_空のヘッダ行のみ出力されること() throws Exception {
        String csv = new TableProjector(new TableConfig()).project(parse(""));

        assertEquals("\n", csv);
    }

    @Test
    void project_正常ケース_区切り文字と改行を設定する_設定値で出力されること() throws Exception {
        Node root = parse("<list><a><x>1</x><y>2</y></a></list>");
        TableConfig config = new TableConfig();
        config.setDelimiter(';');
        config.setRecordSeparator("\r\n");

        String csv = new TableProjector(config).project(root);

        assertEquals("x;y\r\n1;2\r\n", csv);
    }

    @Test
    void project_正常ケース_値に区切り文字を含む_引用符なしでそのまま出力されること() throws Exception {
        Node root = parse("<list><a><x>1,5</x></a></list>");

        String csv = new TableProjector(new TableConfig()).project(root);

        assertEquals("x\n1,5\n", csv);
    }

    @Test
    void project_正常ケース_手組みの木を指定する_合成ルートを除いたパスが列になること() {
        Node root = Node.syntheticRoot("root");
        Node doc = root.addChild(new Node("doc"));
        Node rec = doc.addChild(new Node("rec"));
        rec.addChild(new Node("k", "v"));

        String csv = new TableProjector(new TableConfig()).project(root);

        assertEquals("k\nv\n", csv);
    }

    @Test
    void project_異常ケース_nullを指定する_NullPointerExceptionが送出されること() {
        TableProjector projector = new TableProjector(new TableConfig());
        assertThrows(NullPointerException.class, () -> projector.project(null));
    }
}
