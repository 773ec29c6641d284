package ai.callgraph.scan;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import ai.callgraph.scan.RoutineExtractor.RoutineDefinition;

class RoutineExtractorTest {

    private final RoutineExtractor extractor = new RoutineExtractor(SyntaxProfile.julia());

    @Test
    void findsEveryDefinitionWithItsParameters() {
        final String text = "function f(x)\n  y = g(x)\n  return y\nend\nfunction g(z)\n  return z\nend";

        final List<RoutineDefinition> defs = extractor.extract(text);

        assertThat(defs).extracting(RoutineDefinition::name).containsExactly("f", "g");
        assertThat(defs.get(0).inputs()).containsExactly("x");
        assertThat(defs.get(1).inputs()).containsExactly("z");
        assertThat(defs.get(0).start()).isZero();
        assertThat(text.substring(defs.get(1).start(), defs.get(1).headerEnd())).isEqualTo("function g(z)");
    }

    @Test
    void parametersAreKeptAsWrittenAndEmptiesDropped() {
        final String text = "function getCellNum(gdata::Data,  lat::Number , , lon::Number)\nend\n"
                + "function noArgs()\nend\n";

        final List<RoutineDefinition> defs = extractor.extract(text);

        assertThat(defs.get(0).inputs()).containsExactly("gdata::Data", "lat::Number", "lon::Number");
        assertThat(defs.get(1).inputs()).isEmpty();
    }

    @Test
    void parameterListMaySpanLines() {
        final String text = "@inject_timer function loaddata(project::AbstractString=\"P\";\n"
                + "        jld::Bool=true,\n"
                + "        crf::Float64=0.11)\nend\n";

        final List<RoutineDefinition> defs = extractor.extract(text);

        assertThat(defs).hasSize(1);
        assertThat(defs.get(0).name()).isEqualTo("loaddata");
        assertThat(defs.get(0).inputs())
                .containsExactly("project::AbstractString=\"P\";\n        jld::Bool=true", "crf::Float64=0.11");
    }

    @Test
    void bangNamesAreRoutines() {
        final List<RoutineDefinition> defs = extractor.extract("function load_scenario!(gdata, scenario)\nend\n");

        assertThat(defs).extracting(RoutineDefinition::name).containsExactly("load_scenario!");
    }

    @Test
    void nestedDefinitionsAreReportedToo() {
        final String text = "function outer(a)\n  function inner(b)\n    return b\n  end\n  return inner(a)\nend\n";

        assertThat(extractor.extract(text)).extracting(RoutineDefinition::name).containsExactly("outer", "inner");
    }

    @Test
    void textWithoutDefinitionsGivesNothing() {
        assertThat(extractor.extract("x = 1\n# the function below\nprintln(x)\n")).isEmpty();
        assertThat(extractor.extract("myfunction f(x)\n")).isEmpty();
    }

    @Test
    void unicodeRoutineNamesAreRecognized() {
        final List<RoutineDefinition> defs = extractor.extract("function σ(x)\n  return x\nend\nfunction λ₂!(α, β)\nend\n");

        assertThat(defs).extracting(RoutineDefinition::name).containsExactly("σ", "λ₂!");
        assertThat(defs.get(1).inputs()).containsExactly("α", "β");
    }
}
