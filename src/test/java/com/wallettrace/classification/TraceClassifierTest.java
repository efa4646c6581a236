package com.wallettrace.classification;

import com.wallettrace.domain.AddressCategory;
import com.wallettrace.domain.ClassificationKind;
import com.wallettrace.domain.TraceResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.wallettrace.classification.TraceResults.addFundedMembers;
import static com.wallettrace.classification.TraceResults.addSiblings;
import static com.wallettrace.classification.TraceResults.addSource;
import static com.wallettrace.classification.TraceResults.result;
import static com.wallettrace.classification.TraceResults.trading;
import static org.assertj.core.api.Assertions.assertThat;

class TraceClassifierTest {

    private final TraceClassifier classifier = new TraceClassifier();

    @Test
    @DisplayName("siblings plus funded members of three or more is coordinated")
    void coordinated() {
        TraceResult r = result("1000");
        addSiblings(r, 2);
        addFundedMembers(r, 1);

        assertThat(classifier.classify(r)).isEqualTo(ClassificationKind.COORDINATED);
    }

    @Test
    @DisplayName("coordinated outranks bridge funding")
    void coordinatedBeatsBridge() {
        TraceResult r = result("50000");
        addSource(r, AddressCategory.BRIDGE, "50000");
        addSiblings(r, 4);
        r.setTrading(trading(3, 1, 2L));

        assertThat(classifier.classify(r)).isEqualTo(ClassificationKind.COORDINATED);
    }

    @Test
    @DisplayName("bridge funding with concentrated trading and large funding is sophisticated")
    void sophisticated() {
        TraceResult r = result("10000");
        addSource(r, AddressCategory.BRIDGE, "10000");
        r.setTrading(trading(20, 3, 40L));

        assertThat(classifier.classify(r)).isEqualTo(ClassificationKind.SOPHISTICATED_CONCENTRATED);
    }

    @Test
    @DisplayName("any other bridge funding needs cross-chain review, even when fresh and large")
    void crossChainReview() {
        TraceResult small = result("9999");
        addSource(small, AddressCategory.BRIDGE, "9999");
        small.setTrading(trading(5, 1, 1L));
        TraceResult noTrading = result("20000");
        addSource(noTrading, AddressCategory.BRIDGE, "20000");

        assertThat(classifier.classify(small)).isEqualTo(ClassificationKind.CROSS_CHAIN_REVIEW);
        assertThat(classifier.classify(noTrading)).isEqualTo(ClassificationKind.CROSS_CHAIN_REVIEW);
    }

    @Test
    @DisplayName("young account with large funding")
    void freshLargeFunding() {
        TraceResult r = result("5000");
        r.setTrading(trading(50, 8, 13L));
        TraceResult older = result("5000");
        older.setTrading(trading(50, 8, 14L));

        assertThat(classifier.classify(r)).isEqualTo(ClassificationKind.FRESH_LARGE_FUNDING);
        assertThat(classifier.classify(older)).isEqualTo(ClassificationKind.RETAIL_DIVERSIFIED);
    }

    @Test
    @DisplayName("few trades in a single market with meaningful funding")
    void singleBet() {
        TraceResult r = result("2000");
        r.setTrading(trading(9, 1, 60L));

        assertThat(classifier.classify(r)).isEqualTo(ClassificationKind.SINGLE_BET);
    }

    @Test
    @DisplayName("funding other members below the coordinated threshold")
    void fundsMembers() {
        TraceResult r = result("100");
        addFundedMembers(r, 2);

        assertThat(classifier.classify(r)).isEqualTo(ClassificationKind.FUNDS_MEMBERS);
    }

    @Test
    @DisplayName("one or two siblings is some linked")
    void someLinked() {
        TraceResult r = result("100");
        addSiblings(r, 2);

        assertThat(classifier.classify(r)).isEqualTo(ClassificationKind.SOME_LINKED);
    }

    @Test
    @DisplayName("no links: retail, diversified from five markets")
    void retail() {
        TraceResult diversified = result("100");
        diversified.setTrading(trading(40, 5, 100L));
        TraceResult plain = result("100");
        plain.setTrading(trading(40, 4, 100L));

        assertThat(classifier.classify(diversified)).isEqualTo(ClassificationKind.RETAIL_DIVERSIFIED);
        assertThat(classifier.classify(plain)).isEqualTo(ClassificationKind.RETAIL);
        assertThat(classifier.classify(result("0"))).isEqualTo(ClassificationKind.RETAIL);
    }
}
