package org.udb.condition;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClauseYamlTest {

    private static final String YAML = String.join("\n",
            "allOf:",
            "  - extension:",
            "      name: Zicsr",
            "      version: \">= 2.0\"",
            "  - if:",
            "      xlen: 64",
            "    then:",
            "      param:",
            "        name: SXLEN",
            "        equal: 64",
            "  - not:",
            "      extension:",
            "        name: H",
            "");

    @Test
    void parsesYamlText() {
        Clause clause = ClauseYaml.parse(YAML);
        assertEquals(new Clause.AllOf(List.of(
                new Clause.ExtensionClause("Zicsr", ">= 2.0"),
                new Clause.IfThen(new Clause.XlenClause(64),
                        new Clause.ParamClause(Map.of("name", "SXLEN", "equal", 64))),
                new Clause.Not(new Clause.ExtensionClause("H", null)))), clause);
    }

    @Test
    @DisplayName("La scrittura YAML si rilegge nella stessa clausola")
    void dumpIsReadable() {
        Clause clause = ClauseYaml.parse(YAML);
        assertEquals(clause, ClauseYaml.parse(ClauseYaml.dump(clause)));
    }

    @Test
    void dataUsesGenericWrappers() {
        Object data = ClauseYaml.toData(new Clause.AnyOf(List.of(
                new Clause.ExtensionClause("A", null), new Clause.Constant(false))));
        assertEquals(Map.of("anyOf", List.of(Map.of("extension", Map.of("name", "A")), false)), data);
    }

    @Test
    void booleanDocument() {
        assertEquals(new Clause.Constant(true), ClauseYaml.parse("true"));
    }

    @Test
    void invalidYaml() {
        assertThrows(MalformedConditionException.class, () -> ClauseYaml.parse("allOf: [\n"));
        assertThrows(MalformedConditionException.class, () -> ClauseYaml.parse("- xlen: 32\n"));
    }
}
