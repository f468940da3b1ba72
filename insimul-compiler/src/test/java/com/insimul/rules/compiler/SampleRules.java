package com.insimul.rules.compiler;

import com.insimul.rules.api.model.Condition;
import com.insimul.rules.api.model.Constant;
import com.insimul.rules.api.model.Effect;
import com.insimul.rules.api.model.EffectKind;
import com.insimul.rules.api.model.FieldAccess;
import com.insimul.rules.api.model.Predicate;
import com.insimul.rules.api.model.Rule;
import com.insimul.rules.api.model.Variable;

import java.util.List;

/**
 * Canonical rules shared by the dialect tests.
 */
public final class SampleRules {

    public static final Variable HEIR = new Variable("heir");
    public static final Variable LORD = new Variable("lord");

    private SampleRules() {
    }

    public static Rule nobleSuccession() {
        return Rule.builder("noble_succession")
                .priority(9)
                .likelihood(0.8)
                .conditions(Condition.and(List.of(
                        Predicate.of("Person", HEIR),
                        Predicate.of("Noble", LORD),
                        Predicate.of("parent_of", LORD, HEIR),
                        Condition.not(Condition.or(List.of(
                                Predicate.of("dead", HEIR),
                                Predicate.comparison("<", new FieldAccess(HEIR, "age"), new Constant(16L))))))))
                .effect(Effect.of("inherit_title", HEIR, new FieldAccess(LORD, "title")))
                .effect(Effect.of("add_thought", HEIR, new Constant("I am now the head of the house")))
                .effect(new Effect("announce_heir", List.of(HEIR), EffectKind.EVENT))
                .tag("nobility")
                .tag("inheritance")
                .dependency("succession_base")
                .build();
    }

    public static Rule courtRivalry() {
        Variable a = new Variable("a");
        Variable b = new Variable("b");
        return Rule.builder("court_rivalry")
                .ruleType("volition")
                .priority(3)
                .likelihood(0.25)
                .conditions(Condition.or(List.of(
                        Condition.and(List.of(Predicate.of("Noble", a), Predicate.of("Noble", b))),
                        Predicate.comparison("==", new FieldAccess(a, "house"), new Constant("stark")),
                        Predicate.comparison(">=", new Variable("rank"), new Constant(2.5)))))
                .effect(Effect.of("reduce_reputation", b, new Constant(true)))
                .active(false)
                .build();
    }

    public static Rule welcomeVisitor() {
        return Rule.builder("welcome_visitor")
                .effect(Effect.of("tracery_generate", new Constant("greeting"), new Variable("visitor")))
                .build();
    }

    public static List<Rule> all() {
        return List.of(nobleSuccession(), courtRivalry(), welcomeVisitor());
    }
}
