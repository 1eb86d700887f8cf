package io.github.eutro.relift.test;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.github.eutro.relift.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class PseudocodeRendererTest {
    private static final Pattern GOTO = Pattern.compile("goto (LAB_[0-9a-f]{8});");

    @Test
    void testStraightLine() {
        String text = render("mov r1, 0", "mov r2, 10", "add r1, r1, r2", "return");
        assertEquals("void func_1000(void)\n" +
                "{\n" +
                "    int64_t r1_1;\n" +
                "    int64_t r1_2;\n" +
                "    int64_t r2_1;\n" +
                "\n" +
                "    r1_1 = 0;\n" +
                "    r2_1 = 0xa;\n" +
                "    r1_2 = r1_1 + r2_1;\n" +
                "    return;\n" +
                "}\n", text);
    }

    @Test
    void testIfElse() {
        String text = render(BuildCfgTest.IF_ELSE);
        assertTrue(text.startsWith("int64_t func_1000(int64_t r1)\n"), text);
        assertTrue(text.contains("    if (r1 != 0) {\n"), text);
        assertTrue(text.contains("    } else {\n"), text);
        assertTrue(text.contains("phi("), text);
        assertTrue(text.contains("    return r0_1;\n"), text);
        assertFalse(text.contains("tmp_"), text);
    }

    @Test
    void testWhile() {
        String text = render(StructureTest.WHILE);
        assertTrue(text.startsWith("int64_t func_1000(int64_t r1, int64_t r2)\n"), text);
        assertTrue(text.contains("while ("), text);
        assertFalse(text.contains("while (true)"), text);
        assertFalse(text.contains("goto"), text);
    }

    @Test
    void testWhileWithHeaderStatements() {
        String text = render(
                "mov r1, 0",
                "add r3, r1, 2",
                "bge r3, r2, 0x1014",
                "add r1, r1, 1",
                "b 0x1004",
                "mov r0, r3",
                "return"
        );
        assertTrue(text.contains("while (true) {"), text);
        assertTrue(text.contains(") break;"), text);
    }

    @Test
    void testDoWhileAndInfinite() {
        String doWhile = render(StructureTest.DO_WHILE);
        assertTrue(doWhile.contains("do {"), doWhile);
        assertTrue(doWhile.contains("} while ("), doWhile);

        String forever = render(StructureTest.INFINITE);
        assertTrue(forever.contains("while (true) {"), forever);
        assertFalse(forever.contains("return"), forever);
    }

    @Test
    void testBreak() {
        String text = render(StructureTest.BREAK);
        assertTrue(text.contains("break;"), text);
        assertFalse(text.contains("goto"), text);
    }

    @Test
    void testSwitch() {
        String text = render(StructureTest.SWITCH_CHAIN);
        assertTrue(text.contains("switch (r1) {"), text);
        assertTrue(text.contains("case 1:"), text);
        assertTrue(text.contains("case 3:"), text);
        assertTrue(text.contains("default:"), text);
        assertTrue(text.contains("= 0x1e;"), text);
    }

    @Test
    void testGotoTargetsAreLabelled() {
        String text = render(StructureTest.IRREDUCIBLE);
        Matcher m = GOTO.matcher(text);
        int gotos = 0;
        while (m.find()) {
            gotos++;
            assertTrue(text.contains("\n" + m.group(1) + ":\n"), m.group(1) + " in\n" + text);
        }
        assertTrue(gotos > 0, text);
    }

    @Test
    void testX86FlagsFold() {
        String text = renderX86(
                "cmp rdi, rsi",
                "je 0x100c",
                "mov eax, 1",
                "ret"
        );
        assertTrue(text.contains("func_1000(int64_t rdi, int64_t rsi)"), text);
        assertTrue(text.contains("if (rdi != rsi) {"), text);
        assertFalse(text.contains("ZF"), text);
        assertFalse(text.contains("CF"), text);
    }

    // the names of the locals declared before the body
    static List<String> locals(String text) {
        int open = text.indexOf("{\n") + 2;
        int blank = text.indexOf("\n\n", open);
        List<String> names = new ArrayList<>();
        if (blank < 0 || text.charAt(open) == '\n') return names;
        for (String decl : text.substring(open, blank).split("\n")) {
            names.add(decl.substring(decl.lastIndexOf(' ') + 1, decl.length() - 1));
        }
        return names;
    }

    @Test
    void testOnlyPrintedValuesAreDeclared() {
        String text = renderX86("mov eax, 1", "add eax, 2", "ret");
        List<String> locals = locals(text);
        assertFalse(locals.isEmpty(), text);
        for (String name : locals) {
            assertTrue(text.contains("\n    " + name + " = "), name + " is never assigned in\n" + text);
        }
        assertFalse(text.contains("bool"), text);
        assertFalse(text.contains("zf"), text);
        assertFalse(text.contains("cf"), text);
    }

    @Test
    void testEntryValuesAreNotLocals() {
        String text = renderX86("push rbp", "pop rbp", "ret");
        assertTrue(text.contains("rsp - 8"), text);
        List<String> locals = locals(text);
        assertFalse(locals.contains("rsp"), text);
        assertFalse(locals.contains("rbp"), text);
        assertTrue(locals.contains("rsp_1"), text);
    }
}
