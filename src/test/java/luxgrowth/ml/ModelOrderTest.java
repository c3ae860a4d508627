package luxgrowth.ml;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelOrderTest {

    @Test
    @DisplayName("parse() tolerates spaces and parentheses")
    void parse() {
        assertEquals(ModelOrder.of(2, 1, 3), ModelOrder.parse(" (2, 1,3) "));
        assertThrows(IllegalArgumentException.class, () -> ModelOrder.parse("1,1"));
        assertThrows(IllegalArgumentException.class, () -> ModelOrder.parse("a,b,c"));
        assertThrows(IllegalArgumentException.class, () -> ModelOrder.parse("-1,0,0"));
    }

    @Test
    @DisplayName("parseGrid() and grid() agree on the default 9-order grid")
    void grids() {
        List<ModelOrder> parsed = ModelOrder.parseGrid("1,1,1;1,1,2;1,1,3;2,1,1;2,1,2;2,1,3;3,1,1;3,1,2;3,1,3");
        assertEquals(ModelOrder.grid(1, 3, 1, 1, 3), parsed);
        assertEquals(Arrays.asList(ModelOrder.of(0, 1, 0)), ModelOrder.parseGrid("0,1,0; "));
        assertEquals("(3,1,2)", parsed.get(7).toString());
    }
}
