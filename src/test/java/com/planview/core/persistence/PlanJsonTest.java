package com.planview.core.persistence;

import com.planview.core.model.Plan;
import com.planview.core.model.Task;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlanJsonTest {

    @Test
    @DisplayName("writes two-space indentation with compact empty containers")
    void layout() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("e", "x");
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("a", List.of());
        doc.put("b", Map.of());
        doc.put("c", List.of(1, 2));
        doc.put("d", nested);

        String expected = """
                {
                  "a": [],
                  "b": {},
                  "c": [
                    1,
                    2
                  ],
                  "d": {
                    "e": "x"
                  }
                }""";

        assertEquals(expected, PlanJson.write(doc));
    }

    @Test
    @DisplayName("keys the model does not know survive a read and write")
    void unknownKeysPreserved() throws Exception {
        String json = """
                {
                  "meta": {"project": "Demo", "version": "1.0.0", "owner": "ops"},
                  "phases": [
                    {
                      "id": "0",
                      "name": "Setup",
                      "status": "pending",
                      "color": "blue",
                      "tasks": [
                        {
                          "id": "0.1.1",
                          "title": "Scaffold",
                          "status": "pending",
                          "estimate": 3,
                          "tracking": {"notes": "keep me", "time_spent_minutes": 15}
                        }
                      ]
                    }
                  ],
                  "custom_section": {"flag": true}
                }""";

        Plan plan = PlanJson.read(json);
        Task task = plan.requireTask("0.1.1").task();
        assertEquals(3, task.extras().get("estimate"));
        assertEquals("keep me", task.getTracking().get("notes"));

        String written = PlanJson.write(plan);

        assertTrue(written.contains("\"owner\": \"ops\""));
        assertTrue(written.contains("\"color\": \"blue\""));
        assertTrue(written.contains("\"estimate\": 3"));
        assertTrue(written.contains("\"time_spent_minutes\": 15"));
        assertTrue(written.contains("\"custom_section\": {\n    \"flag\": true\n  }"));
    }

    @Test
    @DisplayName("absent optional task fields are not added on write")
    void noInventedKeys() throws Exception {
        String json = """
                {"phases": [{"id": "0", "name": "Setup", "status": "pending",
                  "tasks": [{"id": "0.1.1", "title": "Bare", "status": "completed"}]}]}""";

        String written = PlanJson.write(PlanJson.read(json));

        assertFalse(written.contains("agent_type"));
        assertFalse(written.contains("depends_on"));
        assertFalse(written.contains("tracking"));
        assertFalse(written.contains("subtasks"));
    }
}
