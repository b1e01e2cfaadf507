package io.mersel.services.feedvalidator.infrastructure.tree;

import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static io.mersel.services.feedvalidator.infrastructure.RuleTestSupport.tree;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ElectionIndex")
class ElectionIndexTest {

    @Test
    @DisplayName("object_ids - trimmed ids in document order, blanks skipped")
    void object_ids() {
        ElectionIndex index = ElectionIndex.of(tree("""
                <ElectionReport>
                  <Party objectId=" par1 "/>
                  <GpUnit objectId="ru1"/>
                  <Person objectId=""/>
                  <Party objectId="ru1"/>
                </ElectionReport>
                """));

        assertThat(index.objectIds()).containsExactly("par1", "ru1");
        assertThat(index.withObjectId("ru1")).extracting(ElectionElement::tag).containsExactly("GpUnit", "Party");
        assertThat(index.contains("par1")).isTrue();
        assertThat(index.contains("")).isFalse();
    }

    @Test
    @DisplayName("first - picks the first element with the requested name")
    void first() {
        ElectionIndex index = ElectionIndex.of(tree("""
                <ElectionReport>
                  <Party objectId="x"/>
                  <GpUnit objectId="x"><Name>second</Name></GpUnit>
                </ElectionReport>
                """));

        assertThat(index.first("GpUnit", "x").childText("Name")).isEqualTo("second");
        assertThat(index.first("Office", "x")).isNull();
        assertThat(index.first("GpUnit", null)).isNull();
    }

    @Test
    @DisplayName("context - built from the tree when not supplied, empty without a tree")
    void context() {
        assertThat(RuleContext.of(tree("<ElectionReport><Party objectId=\"p\"/></ElectionReport>"))
                .index().objectIds()).containsExactly("p");
        assertThat(RuleContext.of(null).index().objectIds()).isEmpty();
    }
}
