package io.github.simbo1905.j2py;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.logging.Logger;

import static io.github.simbo1905.j2py.JavaAst.*;
import static org.assertj.core.api.Assertions.assertThat;

class PythonGeneratorTest extends J2pyLoggingConfig {
    private static final Logger LOG = Logger.getLogger(PythonGeneratorTest.class.getName());

    private static String translate(String source) {
        return JavaToPython.translator().translate(source);
    }

    /// Translates statements placed in a static void method `f` of class `T` and returns
    /// the rendered body, dedented by the two levels of class and method.
    private static String body(String statements) {
        final String python = translate("class T { static void f() { " + statements + " } }");
        final String marker = "    def f() -> None:\n";
        final int at = python.indexOf(marker);
        assertThat(at).as("method header in:\n%s", python).isGreaterThanOrEqualTo(0);
        return python.substring(at + marker.length()).replaceAll("(?m)^ {8}", "");
    }

    @Test
    void rendersCountingLoopAsRange() {
        LOG.info(() -> "TEST: rendersCountingLoopAsRange");
        final String python = translate("""
                class Sum {
                    static int total() {
                        int sum = 0;
                        for (int i = 0; i < 10; i++) { sum = sum + i; }
                        return sum;
                    }
                }
                """);

        assertThat(python).isEqualTo("""
                from __future__ import annotations


                class Sum:
                    @staticmethod
                    def total() -> int:
                        sum: int = 0
                        for i in range(0, 10):
                            sum = sum + i
                        return sum
                """);
    }

    @Test
    void inclusiveLiteralBoundWithStep() {
        LOG.info(() -> "TEST: inclusiveLiteralBoundWithStep");
        assertThat(body("for (int i = 0; i <= 20; i = i + 2) { print(i); }"))
                .startsWith("for i in range(0, 22, 2):\n    print(i)\n");
    }

    @Test
    void inclusiveSymbolicBoundAddsOne() {
        LOG.info(() -> "TEST: inclusiveSymbolicBoundAddsOne");
        assertThat(body("int n = 4; for (int i = 1; i <= n; i++) { }"))
                .isEqualTo("n: int = 4\nfor i in range(1, n + 1):\n    pass\n");
        assertThat(body("int n = 4; for (int i = 0; i <= n - 1; i += 3) { }"))
                .contains("for i in range(0, n - 1 + 1, 3):\n");
        assertThat(body("int n = 4; for (int i = 0; i <= (n > 2 ? n : 2); i++) { }"))
                .contains("for i in range(0, (n if n > 2 else 2) + 1):\n");
    }

    @Test
    void nonCountingLoopFallsBackToWhile() {
        LOG.info(() -> "TEST: nonCountingLoopFallsBackToWhile");
        assertThat(body("int n = 100; int total = 0; for (int i = 1; i < n; i = i * 2) { total += i; }"))
                .isEqualTo("""
                        n: int = 100
                        total: int = 0
                        i: int = 1
                        while i < n:
                            total += i
                            i = i * 2
                        """);
    }

    @Test
    void descendingLoopFallsBackToWhile() {
        LOG.info(() -> "TEST: descendingLoopFallsBackToWhile");
        assertThat(body("for (int i = 10; i > 0; i--) { }"))
                .isEqualTo("i: int = 10\nwhile i > 0:\n    i -= 1\n");
    }

    @Test
    void infiniteForBecomesWhileTrue() {
        LOG.info(() -> "TEST: infiniteForBecomesWhileTrue");
        assertThat(body("for (;;) { break; }")).isEqualTo("while True:\n    break\n");
    }

    @Test
    void rewritesPrintCalls() {
        LOG.info(() -> "TEST: rewritesPrintCalls");
        assertThat(body("System.out.println(\"hi\");")).isEqualTo("print(\"hi\")\n");
        assertThat(body("System.out.print(3);")).isEqualTo("print(3, end=\"\")\n");
        assertThat(body("System.out.println();")).isEqualTo("print()\n");
        assertThat(body("int n = 2; System.out.println(\"n = \" + n);")).endsWith("print(\"n = \" + str(n))\n");
    }

    @Test
    void stringConcatenationConvertsNonStringOperands() {
        LOG.info(() -> "TEST: stringConcatenationConvertsNonStringOperands");
        assertThat(body("int a = 1; int b = 2; String s = a + b + \"!\";"))
                .endsWith("s: str = str(a + b) + \"!\"\n");
        assertThat(body("int a = 1; String s = \"x\" + a + \"y\";"))
                .endsWith("s: str = \"x\" + str(a) + \"y\"\n");
    }

    @Test
    void rendersClassWithFieldsAndConstructor() {
        LOG.info(() -> "TEST: rendersClassWithFieldsAndConstructor");
        final String python = translate("""
                public class Point {
                    private int x;
                    private int y;
                    private static int count = 0;

                    public Point(int x, int y) {
                        this.x = x;
                        this.y = y;
                        count++;
                    }

                    public int getX() { return x; }

                    public double distance(Point other) {
                        int dx = x - other.x;
                        return Math.abs(dx) * 1.0;
                    }
                }
                """);

        assertThat(python).isEqualTo("""
                from __future__ import annotations


                class Point:
                    x: int
                    y: int
                    count: int = 0

                    def __init__(self, x: int, y: int) -> None:
                        self.x = 0
                        self.y = 0
                        self.x = x
                        self.y = y
                        Point.count += 1

                    def getX(self) -> int:
                        return self.x

                    def distance(self, other: Point) -> float:
                        dx: int = self.x - other.x
                        return abs(dx) * 1.0
                """);
    }

    @Test
    void synthesizesInitForInstanceFields() {
        LOG.info(() -> "TEST: synthesizesInitForInstanceFields");
        final String python = translate("""
                class Counter {
                    int count;
                    String label = "c";
                    void inc() { count++; helper(); }
                    void helper() { }
                }
                """);

        assertThat(python).isEqualTo("""
                from __future__ import annotations


                class Counter:
                    count: int
                    label: str

                    def __init__(self) -> None:
                        self.count = 0
                        self.label = "c"

                    def inc(self) -> None:
                        self.count += 1
                        self.helper()

                    def helper(self) -> None:
                        pass
                """);
    }

    @Test
    void instanceInitializerRunsInInit() {
        LOG.info(() -> "TEST: instanceInitializerRunsInInit");
        assertThat(translate("class B { int n; { n = 5; } }")).endsWith("""
                class B:
                    n: int

                    def __init__(self) -> None:
                        self.n = 0
                        self.n = 5
                """);
    }

    @Test
    void staticInitializerRunsInClassBody() {
        LOG.info(() -> "TEST: staticInitializerRunsInClassBody");
        assertThat(translate("class Table { static int[] cells; static { cells = new int[3]; } }")).endsWith("""
                class Table:
                    cells: list[int] = []
                    cells = [0] * 3
                """);
    }

    @Test
    void rendersInheritanceAndSuperCalls() {
        LOG.info(() -> "TEST: rendersInheritanceAndSuperCalls");
        final String python = translate("""
                class Dog extends Animal {
                    Dog(String name) { super(name); }
                    String speak() { return "Woof " + super.speak(); }
                }
                """);

        assertThat(python).endsWith("""
                class Dog(Animal):
                    def __init__(self, name: str) -> None:
                        super().__init__(name)

                    def speak(self) -> str:
                        return "Woof " + str(super().speak())
                """);
    }

    @Test
    void superCallPrecedesFieldInitialisation() {
        LOG.info(() -> "TEST: superCallPrecedesFieldInitialisation");
        assertThat(translate("class C extends P { int k = 1; C() { super(2); k = 3; } }")).endsWith("""
                    def __init__(self) -> None:
                        super().__init__(2)
                        self.k = 1
                        self.k = 3
                """);
    }

    @Test
    void staticMethodCallsQualifyWithClassName() {
        LOG.info(() -> "TEST: staticMethodCallsQualifyWithClassName");
        assertThat(translate("class M { static int sq(int v) { return v * v; } static int f() { return sq(3); } }"))
                .contains("        return M.sq(3)\n");
    }

    @Test
    void addsEntryPointGuardForMain() {
        LOG.info(() -> "TEST: addsEntryPointGuardForMain");
        final String source = """
                public class Hello {
                    public static void main(String[] args) {
                        System.out.println("hi");
                    }
                }
                """;

        assertThat(translate(source)).isEqualTo("""
                from __future__ import annotations
                import sys


                class Hello:
                    @staticmethod
                    def main(args: list[str]) -> None:
                        print("hi")


                if __name__ == "__main__":
                    Hello.main(sys.argv[1:])
                """);

        final var noGuard = JavaToPython.translator(TranslatorOptions.DEFAULT.withEntryPoint(false)).translate(source);
        assertThat(noGuard).doesNotContain("import sys").doesNotContain("__main__");
    }

    @Test
    void honoursIndentWidth() {
        LOG.info(() -> "TEST: honoursIndentWidth");
        final var translator = JavaToPython.translator(TranslatorOptions.DEFAULT.withIndentWidth(2));
        assertThat(translator.translate("class A { void f() { if (true) { return; } } }")).endsWith("""
                class A:
                  def f(self) -> None:
                    if True:
                      return
                """);
    }

    @Test
    void emptyClassAndEmptyInput() {
        LOG.info(() -> "TEST: emptyClassAndEmptyInput");
        assertThat(translate("class E { }")).isEqualTo("from __future__ import annotations\n\n\nclass E:\n    pass\n");
        assertThat(translate("")).isEqualTo("from __future__ import annotations\n");
    }

    @Test
    void separatesClassesWithTwoBlankLines() {
        LOG.info(() -> "TEST: separatesClassesWithTwoBlankLines");
        assertThat(translate("class A { } class B { }")).endsWith("class A:\n    pass\n\n\nclass B:\n    pass\n");
    }

    @Test
    void rendersIfElifElse() {
        LOG.info(() -> "TEST: rendersIfElifElse");
        assertThat(body("int x = 3; int sign; if (x > 0) { sign = 1; } else if (x < 0) { sign = -1; } else { sign = 0; }"))
                .isEqualTo("""
                        x: int = 3
                        sign: int = 0
                        if x > 0:
                            sign = 1
                        elif x < 0:
                            sign = -1
                        else:
                            sign = 0
                        """);
    }

    @Test
    void rendersWhileAndForEach() {
        LOG.info(() -> "TEST: rendersWhileAndForEach");
        assertThat(body("int i = 0; while (i < 10) i += 2;")).isEqualTo("i: int = 0\nwhile i < 10:\n    i += 2\n");
        assertThat(body("String[] names = {\"a\"}; for (String s : names) System.out.println(s);"))
                .isEqualTo("names: list[str] = [\"a\"]\nfor s in names:\n    print(s)\n");
    }

    @Test
    void rendersDoWhileAsLoopWithExitTest() {
        LOG.info(() -> "TEST: rendersDoWhileAsLoopWithExitTest");
        assertThat(body("int i = 0; do { i++; } while (i < 3);")).isEqualTo("""
                i: int = 0
                while True:
                    i += 1
                    if not (i < 3):
                        break
                """);
    }

    @Test
    void rendersSwitchAsMatchWithDefaultLast() {
        LOG.info(() -> "TEST: rendersSwitchAsMatchWithDefaultLast");
        assertThat(body("int day = 2; String name; switch (day) { case 1: name = \"Mon\"; break; "
                + "default: name = \"?\"; case 2: name = \"Tue\"; break; }"))
                .isEqualTo("""
                        day: int = 2
                        name: str = ""
                        match day:
                            case 1:
                                name = "Mon"
                            case 2:
                                name = "Tue"
                            case _:
                                name = "?"
                        """);
    }

    @Test
    void switchOnNamesUsesValuePatternsOrGuards() {
        LOG.info(() -> "TEST: switchOnNamesUsesValuePatternsOrGuards");
        final String python = translate("""
                class S {
                    static final int MAX = 9;
                    static void f(int k, int limit) {
                        switch (k) {
                            case MAX: break;
                            case limit: k = 0; break;
                            case -1: k = 1;
                        }
                        switch (k) { }
                    }
                }
                """);

        assertThat(python).contains("""
                        match k:
                            case S.MAX:
                                pass
                            case _ if k == limit:
                                k = 0
                            case -1:
                                k = 1
                        match k:
                            case _:
                                pass
                """);
    }

    @Test
    void incrementsInsideExpressionsUseAssignmentExpressions() {
        LOG.info(() -> "TEST: incrementsInsideExpressionsUseAssignmentExpressions");
        assertThat(body("int x = 0; int y = ++x; int z = x--;")).isEqualTo("""
                x: int = 0
                y: int = (x := x + 1)
                z: int = ((x := x - 1) + 1)
                """);
    }

    @Test
    void parenthesizesByPythonPrecedence() {
        LOG.info(() -> "TEST: parenthesizesByPythonPrecedence");
        assertThat(body("int a = 1; int b = 2; int c = 3; int z = (a + b) * c;")).endsWith("z: int = (a + b) * c\n");
        assertThat(body("int a = 1; int b = 2; int c = 3; int z = a - (b - c);")).endsWith("z: int = a - (b - c)\n");
        assertThat(body("int a = 1; int b = 2; int c = 3; int z = a - b - c;")).endsWith("z: int = a - b - c\n");
        assertThat(body("boolean a = true; boolean b = false; boolean z = !(a && b);")).endsWith("z: bool = not (a and b)\n");
        assertThat(body("boolean a = true; boolean b = false; boolean z = !a == b;")).endsWith("z: bool = (not a) == b\n");
        assertThat(body("int a = 1; int b = 2; boolean c = true; boolean z = (a < b) == c;")).endsWith("z: bool = (a < b) == c\n");
        assertThat(body("int a = 1; int b = 2; int z = -(a + b);")).endsWith("z: int = -(a + b)\n");
        assertThat(body("boolean a = true; boolean b = false; boolean c = true; boolean z = a || b && c;"))
                .endsWith("z: bool = a or b and c\n");
        assertThat(body("boolean a = true; boolean b = false; boolean c = true; boolean z = (a || b) && c;"))
                .endsWith("z: bool = (a or b) and c\n");
    }

    @Test
    void rendersConditionalExpression() {
        LOG.info(() -> "TEST: rendersConditionalExpression");
        assertThat(body("int a = 1; int b = 2; int m = a > b ? a : b;")).endsWith("m: int = a if a > b else b\n");
    }

    @Test
    void rewritesWellKnownCalls() {
        LOG.info(() -> "TEST: rewritesWellKnownCalls");
        assertThat(body("String s = \"ab\"; int n = s.length();")).endsWith("n: int = len(s)\n");
        assertThat(body("int[] xs = {1}; int n = xs.length;")).endsWith("n: int = len(xs)\n");
        assertThat(body("String s = \"ab\"; boolean same = s.equals(\"ab\");")).endsWith("same: bool = s == \"ab\"\n");
        assertThat(body("String s = \"ab\"; boolean diff = !s.equals(\"ab\");")).endsWith("diff: bool = not (s == \"ab\")\n");
        assertThat(body("int m = Math.max(1, 2);")).isEqualTo("m: int = max(1, 2)\n");
        assertThat(body("int v = Integer.parseInt(\"4\");")).isEqualTo("v: int = int(\"4\")\n");
        assertThat(body("double d = Double.parseDouble(\"4.5\");")).isEqualTo("d: float = float(\"4.5\")\n");
    }

    @Test
    void rendersCastsAndArrays() {
        LOG.info(() -> "TEST: rendersCastsAndArrays");
        assertThat(body("double d = 2.5; int i = (int) d;")).endsWith("i: int = int(d)\n");
        assertThat(body("int n = 3; double d = (double) n;")).endsWith("d: float = float(n)\n");
        assertThat(body("int n = 3; int[] xs = new int[n + 1];")).endsWith("xs: list[int] = [0] * (n + 1)\n");
        assertThat(body("String[] ss = new String[2];")).isEqualTo("ss: list[str] = [\"\"] * 2\n");
        assertThat(body("int[][] grid = new int[3][4];")).isEqualTo("grid: list[list[int]] = [[0] * 4 for _ in range(3)]\n");
        assertThat(body("int[][][] h = new int[2][3][];"))
                .isEqualTo("h: list[list[list[int]]] = [[[] for _ in range(3)] for _ in range(2)]\n");
        assertThat(body("int n = 2; String[][] rows = new String[n][];"))
                .endsWith("rows: list[list[str]] = [[] for _ in range(n)]\n");
        assertThat(body("int[] xs = new int[]{1, 2};")).isEqualTo("xs: list[int] = [1, 2]\n");
        assertThat(body("int[] xs = {1, 2}; xs[0] = xs[1];")).endsWith("xs[0] = xs[1]\n");
    }

    @Test
    void rendersObjectCreationAndDefaults() {
        LOG.info(() -> "TEST: rendersObjectCreationAndDefaults");
        assertThat(body("Point p = new Point(1, 2); Point q; boolean b; double d; var v = p;")).isEqualTo("""
                p: Point = Point(1, 2)
                q: Point = None
                b: bool = False
                d: float = 0.0
                v = p
                """);
    }

    @Test
    void mapsLiterals() {
        LOG.info(() -> "TEST: mapsLiterals");
        assertThat(body("boolean t = true; boolean f = false; String n = null; char c = 'x';")).isEqualTo("""
                t: bool = True
                f: bool = False
                n: str = None
                c: str = 'x'
                """);
    }

    @Test
    void renamesPythonKeywords() {
        LOG.info(() -> "TEST: renamesPythonKeywords");
        assertThat(body("int lambda = 1; int pass = lambda + 1;")).isEqualTo("lambda_: int = 1\npass_: int = lambda_ + 1\n");
    }

    @Test
    void unknownExpressionLeavesDiagnosticComment() {
        LOG.info(() -> "TEST: unknownExpressionLeavesDiagnosticComment");
        assertThat(body("int x = 0; x = #; if (true) { # ; }")).isEqualTo("""
                x: int = 0
                # Unknown node: UNKNOWN:#
                x = None
                if True:
                    # Unknown node: UNKNOWN:#
                    pass
                """);
    }

    @Test
    void emptyAndAbstractBodiesBecomePass() {
        LOG.info(() -> "TEST: emptyAndAbstractBodiesBecomePass");
        assertThat(translate("abstract class Shape { abstract double area(); void noop() { ; } }")).endsWith("""
                class Shape:
                    def area(self) -> float:
                        pass

                    def noop(self) -> None:
                        pass
                """);
    }

    @Test
    void generatesFromHandBuiltTree() {
        LOG.info(() -> "TEST: generatesFromHandBuiltTree");
        final var unit = new CompilationUnit(List.of(new ClassDecl("K", java.util.Set.of(), null, List.of(
                new MethodDecl(java.util.Set.of(Modifier.STATIC), TypeRef.of("void"), "run", List.of(),
                        new Block(List.of(new ExprStmt(new Unknown("odd")))))))));

        assertThat(JavaToPython.translator().generate(unit)).endsWith("""
                class K:
                    @staticmethod
                    def run() -> None:
                        # Unknown node: odd
                        pass
                """);
    }

    @Test
    void fieldIncrementsInsideExpressionsRunBeforeTheLine() {
        LOG.info(() -> "TEST: fieldIncrementsInsideExpressionsRunBeforeTheLine");
        final String python = translate("""
                class C {
                    int count;
                    int[] a = new int[4];
                    int next() { return count++; }
                    int bump() { return ++count; }
                    void put(int v) { a[count++] = v; }
                }
                """);

        assertThat(python).endsWith("""
                class C:
                    count: int
                    a: list[int]

                    def __init__(self) -> None:
                        self.count = 0
                        self.a = [0] * 4

                    def next(self) -> int:
                        _tmp0 = self.count
                        self.count += 1
                        return _tmp0

                    def bump(self) -> int:
                        self.count += 1
                        return self.count

                    def put(self, v: int) -> None:
                        _tmp1 = self.count
                        self.count += 1
                        self.a[_tmp1] = v
                """);
    }

    @Test
    void fieldIncrementsInLoopHeadersAndShortCircuitsAreReported() {
        LOG.info(() -> "TEST: fieldIncrementsInLoopHeadersAndShortCircuitsAreReported");
        final String python = translate("class D { int n; void f() { while (n++ < 3) { } boolean b = n > 0 && n-- > 1; } }");

        assertThat(python).endsWith("""
                        # Unknown node: increment of self.n inside an expression
                        while (self.n) < 3:
                            pass
                        # Unknown node: increment of self.n inside an expression
                        b: bool = self.n > 0 and (self.n) > 1
                """);
    }

    @Test
    void subclassConstructorsCallTheSuperclassConstructor() {
        LOG.info(() -> "TEST: subclassConstructorsCallTheSuperclassConstructor");
        final String python = translate("""
                class Animal { int legs = 4; }
                class Dog extends Animal { String name = "d"; }
                class Cat extends Animal { int lives; Cat(int lives) { this.lives = lives; } }
                """);

        assertThat(python).contains("""
                class Dog(Animal):
                    name: str

                    def __init__(self) -> None:
                        super().__init__()
                        self.name = "d"
                """);
        assertThat(python).endsWith("""
                class Cat(Animal):
                    lives: int

                    def __init__(self, lives: int) -> None:
                        super().__init__()
                        self.lives = 0
                        self.lives = lives
                """);
    }

    @Test
    void delegatingConstructorLeavesFieldsToTheTarget() {
        LOG.info(() -> "TEST: delegatingConstructorLeavesFieldsToTheTarget");
        assertThat(translate("class Pup extends Dog { int age = 1; Pup() { this(2); } }")).endsWith("""
                class Pup(Dog):
                    age: int

                    def __init__(self) -> None:
                        self.__init__(2)
                """);
    }

    @Test
    void nonIntegralCountersFallBackToWhile() {
        LOG.info(() -> "TEST: nonIntegralCountersFallBackToWhile");
        assertThat(body("for (double x = 0.5; x < 3; x++) { }")).isEqualTo("""
                x: float = 0.5
                while x < 3:
                    x += 1
                """);
        assertThat(body("int n = 5; for (int i = 0; i < n / 2.0; i++) { }")).isEqualTo("""
                n: int = 5
                i: int = 0
                while i < n / 2.0:
                    i += 1
                """);
        assertThat(body("double d = 0; for (d = 1; d < 4; d++) { }")).isEqualTo("""
                d: float = 0
                d = 1
                while d < 4:
                    d += 1
                """);
        assertThat(body("int i; for (i = 2; i < 4; i++) { }")).isEqualTo("i: int = 0\nfor i in range(2, 4):\n    pass\n");
        assertThat(body("int n = 6; for (int i = 0; i < n / 2; i++) { }")).endsWith("for i in range(0, n // 2):\n    pass\n");
    }

    @Test
    void breakInsideSwitchArmLeavesOnlyTheArm() {
        LOG.info(() -> "TEST: breakInsideSwitchArmLeavesOnlyTheArm");
        assertThat(body("for (int i = 0; i < 3; i++) { switch (i) { case 1: if (i > 0) { break; } print(i); break; "
                + "default: print(i); } }")).isEqualTo("""
                for i in range(0, 3):
                    match i:
                        case 1:
                            while True:
                                if i > 0:
                                    break
                                print(i)
                                break
                        case _:
                            print(i)
                """);
    }

    @Test
    void breakOfNestedLoopInsideSwitchArmNeedsNoWrapper() {
        LOG.info(() -> "TEST: breakOfNestedLoopInsideSwitchArmNeedsNoWrapper");
        assertThat(body("int k = 1; switch (k) { case 1: while (true) { break; } break; }")).isEqualTo("""
                k: int = 1
                match k:
                    case 1:
                        while True:
                            break
                """);
    }

    @Test
    void switchArmWithBreakAndContinueIsReported() {
        LOG.info(() -> "TEST: switchArmWithBreakAndContinueIsReported");
        assertThat(body("for (int i = 0; i < 3; i++) { switch (i) { case 1: if (i > 0) { break; } continue; "
                + "default: print(i); } }")).isEqualTo("""
                for i in range(0, 3):
                    match i:
                        case 1:
                            # Unsupported node: break inside a switch arm that also continues a loop
                            if i > 0:
                                break
                            continue
                        case _:
                            print(i)
                """);
    }

    @Test
    void integralDivisionIsFloorDivision() {
        LOG.info(() -> "TEST: integralDivisionIsFloorDivision");
        assertThat(body("int a = 7; int b = 2; int q = a / b; double r = a / 2.0; q /= b; long m = (a + b) / 2;"))
                .isEqualTo("""
                        a: int = 7
                        b: int = 2
                        q: int = a // b
                        r: float = a / 2.0
                        q //= b
                        m: int = (a + b) // 2
                        """);
        assertThat(body("int a = 7; var v = a / 2; int w = v / 2;")).endsWith("v = a // 2\nw: int = v // 2\n");
        assertThat(body("int[] xs = {1, 2}; int mid = xs.length / 2;")).endsWith("mid: int = len(xs) // 2\n");
        assertThat(body("double d = 3; d /= 2;")).endsWith("d /= 2\n");
        assertThat(translate("class H { int lo; int hi; int mid() { return (lo + hi) / 2; } }"))
                .contains("        return (self.lo + self.hi) // 2\n");
    }
}
