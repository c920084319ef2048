package bracken.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;

import org.junit.jupiter.api.Test;

public class PythonPrinterTest {

    private static final String PRINT = Builtin.PRINT.definition() + "\n";
    private static final String ASSOC = Builtin.ASSOC.definition() + "\n";

    private final Compiler compiler = new Compiler();

    private String render(String source) {
        return compiler.compile(source).text();
    }

    private static int occurrences(String text, String needle) {
        var count = 0;
        for (var i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) {
            count++;
        }
        return count;
    }

    @Test
    void emptyProgram() {
        var rendering = compiler.compile("");
        assertEquals("", rendering.text());
        assertTrue(rendering.builtins().isEmpty());
    }

    @Test
    void genericCallsAreTransliterated() {
        assertEquals("F(a,b)", render("F[a,b]"));
        assertEquals("F(G(1,x),H())", render("F[G[1, x], H[]]"));
        assertEquals("F(x = 1)", render("F[x = 1]"));
    }

    @Test
    void statementsAreJoinedByNewlines() {
        assertEquals("A()\nB(1)\nC(x)", render("A[] B[1]\nC[x]"));
    }

    @Test
    void printUsesHelper() {
        var rendering = compiler.compile("Print[a, 1]");
        assertEquals(PRINT + "builtin__print(a,1)", rendering.text());
        assertEquals(Set.of(Builtin.PRINT), rendering.builtins());
    }

    @Test
    void letWithPrint() {
        assertEquals(PRINT + "lambda x: builtin__print(x)", render("Let[x, Print[x]]"));
    }

    @Test
    void letBindings() {
        assertEquals("lambda x, y = 2: Foo(x,y)", render("Let[x, y = 2, Foo[x, y]]"));
        assertEquals("lambda : 1", render("Let[1]"));
    }

    @Test
    void letRejectsMalformedShapes() {
        assertThrows(MalformedFormException.class, () -> render("Let[]"));
        var ex = assertThrows(MalformedFormException.class, () -> render("Let[1, x]"));
        assertEquals("Let", ex.getForm());
        assertEquals("printer", ex.stage());
    }

    @Test
    void hashMap() {
        assertEquals("dict()", render("HashMap[]"));
        assertEquals("dict()", render("HashMap[seed]"));
        assertThrows(MalformedFormException.class, () -> render("HashMap[a, b]"));
    }

    @Test
    void droppedHashMapArgumentRequiresNoHelper() {
        var rendering = compiler.compile("HashMap[Print[1]]");
        assertEquals("dict()", rendering.text());
        assertTrue(rendering.builtins().isEmpty());
    }

    @Test
    void map() {
        assertEquals("map(f, xs, ys)", render("Map[f, xs, ys]"));
        assertThrows(MalformedFormException.class, () -> render("Map[f]"));
    }

    @Test
    void list() {
        assertEquals("[1, 2, 3]", render("List[1, 2, 3]"));
        assertEquals("[]", render("List[]"));
    }

    @Test
    void explicitCall() {
        assertEquals("((f)(1,2))", render("Call[f, 1, 2]"));
        assertEquals("((f)())", render("Call[f]"));
        assertThrows(MalformedFormException.class, () -> render("Call[]"));
    }

    @Test
    void associativeMapForms() {
        assertEquals(ASSOC + "builtin__assoc(k, v, m)", render("Assoc[k, v, m]"));
        assertEquals(ASSOC + "(m.get(k, None) != None)", render("Has[k, m]"));
        assertEquals(ASSOC + "(m.get(k))", render("Get[k, m]"));
        assertThrows(MalformedFormException.class, () -> render("Assoc[k, v]"));
        assertThrows(MalformedFormException.class, () -> render("Has[k]"));
        assertThrows(MalformedFormException.class, () -> render("Get[k, m, x]"));
    }

    @Test
    void assocHelperIsInjectedOnce() {
        var text = render("Assoc[a, 1, m]\nHas[a, m]\nGet[a, m]\nF[Get[b, m], Has[b, m]]");
        assertEquals(1, occurrences(text, "def builtin__assoc"));
        assertTrue(text.startsWith(ASSOC));
    }

    @Test
    void helpersPrecedeBodyInFixedOrder() {
        var rendering = compiler.compile("Assoc[k, Print[v], m]\nPrint[1]");
        assertEquals(PRINT + ASSOC + "builtin__assoc(k, builtin__print(v), m)\nbuiltin__print(1)", rendering.text());
        assertEquals(Set.of(Builtin.PRINT, Builtin.ASSOC), rendering.builtins());
    }

    @Test
    void cond() {
        assertEquals("(t if c else f)", render("Cond[c, t, f]"));
        assertThrows(MalformedFormException.class, () -> render("Cond[c, t]"));
    }

    @Test
    void condNestsAsSingleExpression() {
        assertEquals("(t if (b if a else c) else f)", render("Cond[Cond[a, b, c], t, f]"));
        assertEquals("(b if a else c)+1", render("Inc[Cond[a, b, c]]"));
    }

    @Test
    void memoizedLookup() {
        assertEquals(
            ASSOC + "lambda x: ((m.get(x)) if (m.get(x, None) != None) else builtin__assoc(x, f(x), m))",
            render("Let[x, Cond[Has[x,m], Get[x,m], Assoc[x, f[x], m]]]"));
    }

    @Test
    void defFunction() {
        assertEquals(PRINT + "MyPrint = lambda x: builtin__print(x)", render("Def[MyPrint, Args[x], Print[x]]"));
    }

    @Test
    void defParameterForms() {
        assertEquals(
            "f = lambda a, b, c = 2, m = dict(), d = 3: g(a,b,c,m,d)",
            render("Def[f, Args[a, Args[b, c = 2], HashMap[m], d = 3], g[a, b, c, m, d]]"));
        assertEquals("f = lambda : 1", render("Def[f, Args[], 1]"));
    }

    @Test
    void defBinding() {
        assertEquals("x = 1", render("Def[x = 1]"));
        assertEquals("g = lambda y: y", render("Def[g = Let[y, y]]"));
    }

    @Test
    void defRejectsMalformedShapes() {
        assertThrows(MalformedFormException.class, () -> render("Def[f]"));
        assertThrows(MalformedFormException.class, () -> render("Def[f, x, y]"));
        assertThrows(MalformedFormException.class, () -> render("Def[f, Args[x], y, z]"));
        assertThrows(MalformedFormException.class, () -> render("Def[f, Args[1], y]"));
        var ex = assertThrows(MalformedFormException.class, () -> render("Def[f, Args[HashMap[a, b]], y]"));
        assertEquals("HashMap", ex.getForm());
        assertThrows(MalformedFormException.class, () -> render("Def[f, Args[HashMap[]], y]"));
    }

    @Test
    void incIsTextual() {
        assertEquals("2+1", render("Inc[2]"));
        assertEquals("a+1,f(b)+1", render("Inc[a, f[b]]"));
        assertEquals("", render("Inc[]"));
    }

    @Test
    void printerKeepsNoStateBetweenRenders() {
        var printer = new PythonPrinter();
        var first = printer.render(compiler.parse("Print[1]"));
        var second = printer.render(compiler.parse("F[1]"));
        assertTrue(first.uses(Builtin.PRINT));
        assertFalse(second.uses(Builtin.PRINT));
        assertEquals("F(1)", second.text());
    }
}
