package io.github.yok.schemaarchitect.ddl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.schemaarchitect.config.DdlOrderingConfig;
import io.github.yok.schemaarchitect.config.UnparsedStatementPolicy;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.apache.commons.io.IOUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DdlDependencyResolverTest {

    private DdlOrderingConfig config;
    private DdlDependencyResolver resolver;

    @BeforeEach
    void setUp() {
        config = new DdlOrderingConfig();
        resolver = new DdlDependencyResolver(config);
    }

    /**
     * Asserts that {@code parent}'s statement appears before {@code child}'s in {@code output}.
     */
    private static void assertBefore(String output, String parent, String child) {
        int parentIndex = output.indexOf(parent);
        int childIndex = output.indexOf(child);
        assertTrue(parentIndex >= 0, "missing: " + parent);
        assertTrue(childIndex >= 0, "missing: " + child);
        assertTrue(parentIndex < childIndex, parent + " should precede " + child);
    }

    @Test
    void resolve_正常ケース_外部キー参照先が後に書かれている_参照先が先に並ぶこと() {
        String input =
                "CREATE TABLE b (id INT, a_id INT REFERENCES a(id)); CREATE TABLE a (id INT);";

        String output = resolver.resolve(input);

        assertEquals(DdlDependencyResolver.ORDERED_HEADER + "\n\n"
                + "CREATE TABLE a (id INT);\n\n"
                + "CREATE TABLE b (id INT, a_id INT REFERENCES a(id));", output);
    }

    @Test
    void resolve_正常ケース_SELECTのみ_入力がそのまま返ること() {
        assertEquals("SELECT * FROM users;", resolver.resolve("SELECT * FROM users;"));
    }

    @Test
    void resolve_正常ケース_DMLのみ_入力と同一で冪等であること() {
        List<String> inputs = List.of("", "   ", "INSERT INTO t VALUES (1);\nUPDATE t SET a = 2;",
                "DELETE FROM t WHERE id = 3", "ALTER TABLE t ADD CONSTRAINT fk FOREIGN KEY (a)"
                        + " REFERENCES other (id);",
                "CREATE  TABLE spaced (id INT);");

        for (String input : inputs) {
            String once = resolver.resolve(input);
            assertEquals(input, once);
            assertEquals(once, resolver.resolve(once));
        }
    }

    @Test
    void resolve_正常ケース_nullを指定する_nullが返ること() {
        assertNull(resolver.resolve(null));
    }

    @Test
    void resolve_異常ケース_相互参照_警告付きで元のテキストが返ること() {
        String input = "CREATE TABLE x (id INT, y_id INT REFERENCES y(id));\n"
                + "CREATE TABLE y (id INT, x_id INT REFERENCES x(id));";

        String output = resolver.resolve(input);

        assertTrue(output.startsWith(DdlDependencyResolver.CYCLE_WARNING_PREFIX));
        String warningLine = output.substring(0, output.indexOf('\n'));
        assertTrue(warningLine.contains("x, y"));
        assertEquals(input, output.substring(output.indexOf('\n') + 1));
        assertFalse(output.contains(DdlDependencyResolver.ORDERED_HEADER));
    }

    @Test
    void resolve_正常ケース_3テーブルのチェーン_a_b_cの順になること() {
        String input = "CREATE TABLE c (id INT, b_id INT REFERENCES b(id));\n"
                + "CREATE TABLE b (id INT, a_id INT REFERENCES a(id));\n"
                + "CREATE TABLE a (id INT);";

        String output = resolver.resolve(input);

        assertTrue(output.startsWith(DdlDependencyResolver.ORDERED_HEADER));
        assertBefore(output, "CREATE TABLE a ", "CREATE TABLE b ");
        assertBefore(output, "CREATE TABLE b ", "CREATE TABLE c ");
    }

    @Test
    void resolve_正常ケース_スキーマファイル_全テーブルが依存順に1回ずつ出力されること()
            throws IOException {
        String input = IOUtils.resourceToString("/ddl/shop_schema.sql", StandardCharsets.UTF_8);

        String output = resolver.resolve(input);

        assertTrue(output.startsWith(DdlDependencyResolver.ORDERED_HEADER));
        List<String> headers = List.of("create table customers", "CREATE TABLE categories",
                "CREATE TABLE orders", "CREATE TABLE `products`", "CREATE TABLE order_items");
        int previous = -1;
        for (String header : headers) {
            int index = output.indexOf(header);
            assertTrue(index > previous, header + " is out of order");
            assertEquals(index, output.lastIndexOf(header), header + " is duplicated");
            previous = index;
        }
        // 文字列リテラル内のセミコロンで文が分割されないこと
        assertTrue(output.contains("DEFAULT 'deliver; ring twice'\n);"));
        // 先頭コメントは文の一部として保持される
        assertTrue(output
                .contains("-- Online shop schema, children first\nCREATE TABLE order_items"));
    }

    @Test
    void resolve_正常ケース_バッチ外参照とバッチ内参照が混在_順序付けできること() {
        String input = "CREATE TABLE orders (id INT, customer_id INT REFERENCES customers(id),"
                + " region_id INT REFERENCES regions(id));\n"
                + "CREATE TABLE customers (id INT);";

        String output = resolver.resolve(input);

        assertTrue(output.startsWith(DdlDependencyResolver.ORDERED_HEADER));
        assertBefore(output, "CREATE TABLE customers", "CREATE TABLE orders");
    }

    @Test
    void resolve_正常ケース_ヘッダのない文_DROP設定では出力から除かれること() {
        String input = "CREATE TABLE b (a_id INT REFERENCES a(id));\n"
                + "INSERT INTO a VALUES (1);\n" + "CREATE TABLE a (id INT);";

        String output = resolver.resolve(input);

        assertFalse(output.contains("INSERT INTO"));
        assertFalse(output.contains(DdlDependencyResolver.UNPARSED_HEADER));
        assertBefore(output, "CREATE TABLE a", "CREATE TABLE b");
    }

    @Test
    void resolve_正常ケース_ヘッダのない文_APPEND設定では末尾に元の順で追加されること() {
        config.setUnparsedStatementPolicy(UnparsedStatementPolicy.APPEND);
        String input = "CREATE TABLE b (a_id INT REFERENCES a(id));\n"
                + "INSERT INTO a VALUES (1);\n" + "CREATE TABLE a (id INT);\n"
                + "CREATE INDEX idx_b ON b (a_id);";

        String output = resolver.resolve(input);

        assertEquals(DdlDependencyResolver.ORDERED_HEADER + "\n\n"
                + "CREATE TABLE a (id INT);\n\n"
                + "CREATE TABLE b (a_id INT REFERENCES a(id));\n\n"
                + DdlDependencyResolver.UNPARSED_HEADER + "\n\n"
                + "INSERT INTO a VALUES (1);\n\n"
                + "CREATE INDEX idx_b ON b (a_id);", output);
    }

    @Test
    void resolve_正常ケース_認識できるテーブルが1つもない_ヘッダのみが返ること() {
        assertEquals(DdlDependencyResolver.ORDERED_HEADER,
                resolver.resolve("CREATE TABLE public.users (id INT);"));
    }

    @Test
    void resolve_異常ケース_自己参照_既定では循環として警告されること() {
        String input = "CREATE TABLE employee (id INT, manager_id INT REFERENCES employee(id));";

        String output = resolver.resolve(input);

        assertTrue(output.startsWith(DdlDependencyResolver.CYCLE_WARNING_PREFIX));
        assertTrue(output.contains("employee). Using original order."));
        assertTrue(output.endsWith(input));
    }

    @Test
    void resolve_正常ケース_自己参照を無視する設定_順序付けされること() {
        config.setIgnoreSelfReferences(true);
        String input = "CREATE TABLE employee (id INT, manager_id INT REFERENCES employee(id));";

        assertEquals(DdlDependencyResolver.ORDERED_HEADER + "\n\n" + input,
                resolver.resolve(input));
    }

    @Test
    void resolve_正常ケース_出力を再度解決する_同じ順序が保たれること() {
        String input =
                "CREATE TABLE b (id INT, a_id INT REFERENCES a(id)); CREATE TABLE a (id INT);";

        String once = resolver.resolve(input);
        String twice = resolver.resolve(once);

        // 先頭のコメント行は最初の文の一部として扱われる
        assertEquals(once, twice.substring(twice.indexOf('\n') + 2));
    }

    @Test
    void resolve_正常ケース_複数スレッドから同時に呼び出す_同じ結果が返ること() throws Exception {
        String input = "CREATE TABLE c (b_id INT REFERENCES b(id));\n"
                + "CREATE TABLE b (a_id INT REFERENCES a(id));\n" + "CREATE TABLE a (id INT);";
        String expected = resolver.resolve(input);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(executor.submit(() -> resolver.resolve(input)));
            }
            for (Future<String> future : futures) {
                assertEquals(expected, future.get());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void order_正常ケース_解析済みの文を指定する_成功結果が返ること() {
        List<DdlStatement> statements = new ArrayList<>();
        CreateTableParser.parse("CREATE TABLE b (a_id INT REFERENCES a(id))")
                .ifPresent(statements::add);
        CreateTableParser.parse("CREATE TABLE a (id INT)").ifPresent(statements::add);

        OrderedResult result = resolver.order(statements);

        assertFalse(result.isCycleDetected());
        assertEquals("a", result.getOrderedStatements().get(0).getTableName());
        assertEquals("b", result.getOrderedStatements().get(1).getTableName());
    }

    @Test
    void containsCreateTable_正常ケース_大文字小文字を区別しない_判定されること() {
        assertTrue(DdlDependencyResolver.containsCreateTable("create table t (id int)"));
        assertTrue(DdlDependencyResolver.containsCreateTable("Create Table t (id int)"));
        assertFalse(DdlDependencyResolver.containsCreateTable("SELECT 1"));
        assertFalse(DdlDependencyResolver.containsCreateTable(null));
    }

    @Test
    void resolve_正常ケース_バックスラッシュでエスケープした引用符を含む_全テーブルが順序付けされること() {
        String input = "CREATE TABLE b (id INT COMMENT 'it\\'s', a_id INT REFERENCES a(id));\n"
                + "CREATE TABLE c (id INT, d_id INT REFERENCES d(id));\n"
                + "CREATE TABLE d (id INT);\n" + "CREATE TABLE a (id INT);";

        String output = resolver.resolve(input);

        assertEquals(DdlDependencyResolver.ORDERED_HEADER + "\n\n"
                + "CREATE TABLE d (id INT);\n\n"
                + "CREATE TABLE a (id INT);\n\n"
                + "CREATE TABLE c (id INT, d_id INT REFERENCES d(id));\n\n"
                + "CREATE TABLE b (id INT COMMENT 'it\\'s', a_id INT REFERENCES a(id));", output);
    }

    @Test
    void resolve_正常ケース_閉じられていない引用符を含む_後続の文が失われないこと() {
        String input = "CREATE TABLE b (a_id INT REFERENCES a(id), note CHAR(1) DEFAULT 'x);\n"
                + "CREATE TABLE a (id INT);";

        String output = resolver.resolve(input);

        assertEquals(DdlDependencyResolver.ORDERED_HEADER + "\n\n"
                + "CREATE TABLE a (id INT);\n\n"
                + "CREATE TABLE b (a_id INT REFERENCES a(id), note CHAR(1) DEFAULT 'x);", output);
    }

    @Test
    void resolve_正常ケース_大文字小文字だけが異なる引用識別子と裸の識別子_両方が出力されること() {
        String input = "CREATE TABLE \"Users\" (id INT); CREATE TABLE users (id INT);";

        String output = resolver.resolve(input);

        assertEquals(DdlDependencyResolver.ORDERED_HEADER + "\n\n"
                + "CREATE TABLE \"Users\" (id INT);\n\n"
                + "CREATE TABLE users (id INT);", output);
    }
}
