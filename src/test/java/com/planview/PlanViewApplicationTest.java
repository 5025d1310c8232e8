package com.planview;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PlanViewApplicationTest {

    @Test
    @DisplayName("planFileArgument finds -f, --file and --file=")
    void planFileArgument() {
        assertEquals(Optional.of("a.json"), PlanViewApplication.planFileArgument(new String[]{"-f", "a.json", "serve"}));
        assertEquals(Optional.of("b.json"), PlanViewApplication.planFileArgument(new String[]{"serve", "--file", "b.json"}));
        assertEquals(Optional.of("c.json"), PlanViewApplication.planFileArgument(new String[]{"--file=c.json", "serve"}));
    }

    @Test
    @DisplayName("planFileArgument is empty when no file is given or the value is missing")
    void noPlanFile() {
        assertTrue(PlanViewApplication.planFileArgument(new String[]{"serve"}).isEmpty());
        assertTrue(PlanViewApplication.planFileArgument(new String[]{"serve", "-f"}).isEmpty());
    }
}
