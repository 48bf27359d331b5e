package io.github.yok.schemaarchitect.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class UsageTypeTest {

    @Test
    void fromLabel_正常ケース_大文字小文字と空白を含む_該当する種別が返ること() {
        assertEquals(Optional.of(UsageType.OLTP), UsageType.fromLabel("OLTP"));
        assertEquals(Optional.of(UsageType.STREAM), UsageType.fromLabel(" stream "));
        assertEquals(Optional.of(UsageType.OLLP), UsageType.fromLabel("Ollp"));
    }

    @Test
    void fromLabel_異常ケース_未知または空のラベル_emptyが返ること() {
        assertTrue(UsageType.fromLabel("GRAPH").isEmpty());
        assertTrue(UsageType.fromLabel("").isEmpty());
        assertTrue(UsageType.fromLabel("   ").isEmpty());
        assertTrue(UsageType.fromLabel(null).isEmpty());
    }
}
