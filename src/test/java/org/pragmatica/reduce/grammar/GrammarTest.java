package org.pragmatica.reduce.grammar;

import org.junit.jupiter.api.Test;
import org.pragmatica.reduce.tree.ParseTree;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class GrammarTest {

    @Test
    void build_withoutRules_producesNothing() {
        var builder = Grammar.<String>builder();
        builder.symbol("Unused");

        assertTrue(builder.build().isEmpty());
    }

    @Test
    void build_firstRuleBecomesDefault() {
        var builder = Grammar.<String>builder();
        var s = builder.symbol("S");
        var first = Rule.<String>builder(s).token("a").build();
        var second = Rule.<String>builder(s).token("b").build();
        var third = Rule.<String>builder(s).token("c").build();

        var grammar = builder.add(first)
                             .add(second)
                             .add(third)
                             .build()
                             .orElseThrow();

        assertSame(first, grammar.defaultRule());
        assertEquals(List.of(second, third), grammar.additionalRules());
        assertEquals(List.of(first, second, third), grammar.rules());
    }

    @Test
    void symbols_fromOneBuilder_areDistinct() {
        var builder = Grammar.<String>builder();

        var a = builder.symbol();
        var b = builder.symbol("B");

        assertNotEquals(a, b);
    }

    @Test
    void symbols_fromDifferentBuilders_neverCollide() {
        var one = Grammar.<String>builder().symbol();
        var other = Grammar.<String>builder().symbol();

        assertEquals(one.sequence(), other.sequence());
        assertNotEquals(one, other);
    }

    @Test
    void describe_usesNamesWhenKnown() {
        var builder = Grammar.<String>builder();
        var named = builder.symbol("RelOp");
        var anonymous = builder.symbol();
        var grammar = builder.add(Rule.<String>builder(named).nonterminal(anonymous).build())
                             .build()
                             .orElseThrow();

        assertEquals("RelOp", grammar.describe(named));
        assertEquals(anonymous.toString(), grammar.describe(anonymous));
        assertThat(grammar.symbolName(anonymous)).isEmpty();
        assertEquals(anonymous.scope(), grammar.scope());
    }

    @Test
    void toString_listsRulesInMatchingOrder() {
        var builder = Grammar.<String>builder();
        var relOp = builder.symbol("RelOp");
        var grammar = builder.add(Rule.<String>builder(relOp).token("<").token("=").build())
                             .add(Rule.<String>builder(relOp).token("<").build())
                             .build()
                             .orElseThrow();

        assertEquals("RelOp -> '<' '='\nRelOp -> '<'", grammar.toString());
    }

    @Test
    void print_rendersTreeWithSymbolNames() {
        var builder = Grammar.<String>builder();
        var relOp = builder.symbol("RelOp");
        var grammar = builder.add(Rule.<String>builder(relOp).token("<").token("=").build())
                             .build()
                             .orElseThrow();
        var tree = ParseTree.node(relOp, List.of(ParseTree.leaf("<"), ParseTree.leaf("=")));

        assertEquals("RelOp\n  '<'\n  '='\n", grammar.print(tree));
    }

    @Test
    void build_acceptsRulesWithForeignSymbols() {
        var foreign = Grammar.<String>builder().symbol();
        var builder = Grammar.<String>builder();
        var s = builder.symbol("S");

        var grammar = builder.add(Rule.<String>builder(s).nonterminal(foreign).build())
                             .build();

        assertTrue(grammar.isPresent());
    }
}
