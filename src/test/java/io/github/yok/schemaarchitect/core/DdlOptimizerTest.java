package io.github.yok.schemaarchitect.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.schemaarchitect.config.UsageType;
import org.junit.jupiter.api.Test;

class DdlOptimizerTest {

    private final DdlOptimizer optimizer = new DdlOptimizer();

    @Test
    void optimize_正常ケース_OLTPを指定する_DDLの後に注記が付くこと() {
        String ddl = "CREATE TABLE t (id INT);";

        String result = optimizer.optimize(ddl, "OLTP");

        assertEquals(ddl + "\n-- OPTIMIZATION FOR OLTP:\n"
                + "-- Optimized for high-volume write speed and data integrity "
                + "(suggesting indexes on FK/PK and proper normalization).\n", result);
    }

    @Test
    void optimize_正常ケース_小文字のラベルを指定する_大文字で見出しが出力されること() {
        String result = optimizer.optimize("CREATE TABLE t (id INT);", "olap");

        assertTrue(result.contains("\n-- OPTIMIZATION FOR OLAP:\n"));
        assertTrue(result.endsWith(DdlOptimizer.RECOMMENDATIONS.get(UsageType.OLAP) + "\n"));
    }

    @Test
    void optimize_正常ケース_全ての利用種別_種別ごとの注記が付くこと() {
        for (UsageType type : UsageType.values()) {
            String result = optimizer.optimize("", type.name());
            assertEquals("\n-- OPTIMIZATION FOR " + type.name() + ":\n"
                    + DdlOptimizer.RECOMMENDATIONS.get(type) + "\n", result);
        }
    }

    @Test
    void optimize_正常ケース_未知の種別を指定する_汎用の注記が付くこと() {
        String result = optimizer.optimize("CREATE TABLE t (id INT);", "graph");

        assertEquals("CREATE TABLE t (id INT);\n-- OPTIMIZATION FOR GRAPH:\n"
                + DdlOptimizer.GENERAL_RECOMMENDATION + "\n", result);
    }

    @Test
    void optimize_正常ケース_nullを指定する_空文字として扱われること() {
        assertEquals("\n-- OPTIMIZATION FOR :\n" + DdlOptimizer.GENERAL_RECOMMENDATION + "\n",
                optimizer.optimize(null, null));
    }
}
