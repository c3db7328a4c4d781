package papyri.d5.converter.transform;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class AdditionPlacementTest {

    @Test
    void keepsSingleLetterAboveTheLineInline() {
        Rendering rendering = AdditionPlacement.render("above", Rendering.of("Γ"));

        assertThat(rendering.plainText()).isEqualTo("Γ");
        assertThat(rendering.insertions()).isEmpty();
    }

    @Test
    void defersLongerAdditionsAboveTheLine() {
        Rendering rendering = AdditionPlacement.render("above", Rendering.of("ΓΔ"));

        assertThat(rendering.plainText()).isEqualTo("\u2191");
        assertThat(rendering.insertions()).containsExactly(InsertionRequest.before("ΓΔ"));
    }

    @Test
    void placesBelowAndRightAfterTheLine() {
        assertThat(AdditionPlacement.render("below", Rendering.of("Γ")).insertions())
                .containsExactly(InsertionRequest.after("Γ"));
        assertThat(AdditionPlacement.render("right", Rendering.of("Γ")).plainText()).isEqualTo("\u2192");
    }

    @Test
    void interlinearAdditionLeavesNoMarker() {
        Rendering rendering = AdditionPlacement.render("interlinear", Rendering.of("Γ"));

        assertThat(rendering.plainText()).isEmpty();
        assertThat(rendering.insertions()).containsExactly(InsertionRequest.before("Γ"));
    }

    @Test
    void marginAdditionsKeepOnlyTheMarker() {
        assertThat(AdditionPlacement.render("margin", Rendering.of("Γ")))
                .isEqualTo(Rendering.of("\u2194"));
        assertThat(AdditionPlacement.render("top", Rendering.of("Γ"))).isEqualTo(Rendering.of("\u219F"));
    }

    @Test
    void unknownOrMissingPlaceKeepsContent() {
        assertThat(AdditionPlacement.render(null, Rendering.of("Γ"))).isEqualTo(Rendering.of("Γ"));
        assertThat(AdditionPlacement.render("sideways", Rendering.of("Γ"))).isEqualTo(Rendering.of("Γ"));
    }

    @Test
    void listsOnlyVisibleSymbols() {
        assertThat(AdditionPlacement.symbols()).hasSize(7).doesNotContain("");
        assertThat(AdditionPlacement.of("left")).contains(AdditionPlacement.LEFT);
        assertThat(List.of(AdditionPlacement.values())).hasSize(8);
    }
}
