package org.javelin.benchmark;

import java.util.concurrent.TimeUnit;

import org.javelin.Javelin;
import org.javelin.JavelinConfig;
import org.javelin.transpiler.TranspiledResult;
import org.javelin.transpiler.types.TypeOracle;
import org.openjdk.jmh.annotations.*;

/**
 * Whole-file transpilation: text rewrites, parse, plugin phases and printing. The typed
 * variant adds the symbol solver pass.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Fork(2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class TranspileBenchmark {

    static final String SOURCE =
            "import java.util.List;\n" +
            "\n" +
            "union Shape {\n" +
            "    Circle(double radius),\n" +
            "    Square(double side),\n" +
            "    Empty\n" +
            "}\n" +
            "\n" +
            "class Shapes {\n" +
            "    double area(Shape shape) {\n" +
            "        return match (shape) {\n" +
            "            Circle(r) => 3.14 * r * r,\n" +
            "            Square(s) => s * s,\n" +
            "            Empty => 0.0\n" +
            "        };\n" +
            "    }\n" +
            "\n" +
            "    double total(List<Shape> shapes) {\n" +
            "        double sum = 0.0;\n" +
            "        for (Shape shape : shapes) {\n" +
            "            sum += area(shape);\n" +
            "        }\n" +
            "        return sum;\n" +
            "    }\n" +
            "\n" +
            "    Option<Shape> largest(List<Shape> shapes) {\n" +
            "        if (shapes.isEmpty()) {\n" +
            "            return None();\n" +
            "        }\n" +
            "        Shape first = shapes.get(0);\n" +
            "        return Some(first);\n" +
            "    }\n" +
            "\n" +
            "    Result<Double, String> checked(Shape shape) {\n" +
            "        let value = validate(shape)?;\n" +
            "        return Ok(value);\n" +
            "    }\n" +
            "\n" +
            "    Result<Double, String> validate(Shape shape) {\n" +
            "        let a = area(shape);\n" +
            "        return a >= 0 ? Ok(a) : Err(\"negative area\");\n" +
            "    }\n" +
            "}\n";

    @State(Scope.Benchmark)
    public static class JavelinState {

        final Javelin structural = Javelin.builder().typeOracle(TypeOracle.unavailable()).build();
        final Javelin typed = new Javelin(JavelinConfig.defaults());
    }

    @Benchmark
    public TranspiledResult structuralTypes(JavelinState state) {
        return state.structural.transpile("Shapes.jvl", SOURCE);
    }

    @Benchmark
    public TranspiledResult symbolSolverTypes(JavelinState state) {
        return state.typed.transpile("Shapes.jvl", SOURCE);
    }
}
