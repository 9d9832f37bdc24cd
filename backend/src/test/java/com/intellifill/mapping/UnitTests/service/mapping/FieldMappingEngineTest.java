package com.intellifill.mapping.UnitTests.service.mapping;

import static com.intellifill.mapping.fixtures.TestFixtures.source;
import static com.intellifill.mapping.fixtures.TestFixtures.target;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.intellifill.mapping.dto.field.FieldMapping;
import com.intellifill.mapping.dto.field.FieldTypeGuess;
import com.intellifill.mapping.dto.field.SourceField;
import com.intellifill.mapping.dto.field.TargetField;
import com.intellifill.mapping.fixtures.TestFixtures;
import com.intellifill.mapping.service.mapping.FieldMappingEngine;
import com.intellifill.mapping.service.mapping.MappingConfig;
import com.intellifill.mapping.service.scoring.SignalScores;
import com.intellifill.mapping.service.scoring.SimilarityCache;
import com.intellifill.mapping.service.scoring.SimilarityScorer;

@DisplayName("FieldMappingEngine Tests")
class FieldMappingEngineTest {

  private FieldMappingEngine engine;
  private MappingConfig config;

  @BeforeEach
  void setUp() {
    engine = new FieldMappingEngine(new SimilarityScorer());
    config = MappingConfig.defaults();
  }

  @Nested
  @DisplayName("Reference scenarios")
  class ScenarioTests {

    @Test
    @DisplayName("Should map camelCase source onto snake_case target with full confidence")
    void shouldMapExactNameAcrossStyles() {
      List<FieldMapping> mappings =
          engine.map(
              List.of(source("firstName", "John", FieldTypeGuess.NAME)),
              List.of(target("first_name", FieldTypeGuess.NAME, true)),
              config);

      assertThat(mappings).hasSize(1);
      FieldMapping mapping = mappings.get(0);
      assertThat(mapping.getSourceName()).isEqualTo("firstName");
      assertThat(mapping.getTargetName()).isEqualTo("first_name");
      assertThat(mapping.getValue()).isEqualTo("John");
      assertThat(mapping.getConfidence()).isEqualTo(1.0);
      assertThat(mapping.isFlagged()).isFalse();
    }

    @Test
    @DisplayName("Should map email_address onto email through the alias table")
    void shouldMapEmailAlias() {
      List<FieldMapping> mappings =
          engine.map(
              List.of(source("email_address", "john@example.com", FieldTypeGuess.EMAIL)),
              List.of(target("email", FieldTypeGuess.EMAIL, true)),
              config);

      assertThat(mappings).hasSize(1);
      assertThat(mappings.get(0).getConfidence()).isGreaterThanOrEqualTo(0.9).isLessThan(1.0);
      assertThat(mappings.get(0).getStrategyBreakdown().get(SignalScores.ALIAS)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should map email_address onto email from name and type evidence alone")
    void shouldMapEmailWithoutAliases() {
      MappingConfig noAliases = config.toBuilder().aliasGroups(new HashMap<>()).build();

      List<FieldMapping> mappings =
          engine.map(
              List.of(source("email_address", "john@example.com", FieldTypeGuess.EMAIL)),
              List.of(target("email", FieldTypeGuess.EMAIL, true)),
              noAliases);

      assertThat(mappings).hasSize(1);
      // (0.3 * 5/12 + 0.25 * 0.75 + 0.25 * 1.0) / 0.8
      assertThat(mappings.get(0).getConfidence()).isCloseTo(0.7031, within(1e-4));
      assertThat(mappings.get(0).isFlagged()).isFalse();
    }

    @Test
    @DisplayName("Should assign a single target to only one of two equally good sources")
    void shouldBreakTiesDeterministically() {
      List<FieldMapping> mappings =
          engine.map(
              List.of(
                  source("name2", "Jane Roe", FieldTypeGuess.NAME),
                  source("name1", "John Doe", FieldTypeGuess.NAME)),
              List.of(target("fullName", FieldTypeGuess.NAME, true)),
              config);

      assertThat(mappings).hasSize(1);
      assertThat(mappings.get(0).getSourceName()).isEqualTo("name1");
      assertThat(mappings.get(0).getConfidence()).isEqualTo(0.6875);
      assertThat(mappings.get(0).isFlagged()).isTrue();
    }

    @Test
    @DisplayName("Should leave a target unassigned when nothing reaches the candidate floor")
    void shouldLeaveUnrelatedTargetUnassigned() {
      List<FieldMapping> mappings =
          engine.map(
              List.of(source("first_name", "John", FieldTypeGuess.NAME)),
              List.of(target("passport_number", FieldTypeGuess.NUMERIC, true)),
              config);

      assertThat(mappings).isEmpty();
    }
  }

  @Nested
  @DisplayName("Assignment invariants")
  class InvariantTests {

    @Test
    @DisplayName("Should map a full applicant form one to one in schema order")
    void shouldMapApplicantForm() {
      List<FieldMapping> mappings =
          engine.map(TestFixtures.applicantSources(), TestFixtures.applicantForm(), config);

      Map<String, String> sourceByTarget =
          mappings.stream()
              .collect(Collectors.toMap(FieldMapping::getTargetName, FieldMapping::getSourceName));
      assertThat(mappings)
          .extracting(FieldMapping::getTargetName)
          .containsExactly("first_name", "last_name", "email", "date_of_birth", "phone_number");
      assertThat(sourceByTarget)
          .containsEntry("first_name", "firstName")
          .containsEntry("last_name", "surname")
          .containsEntry("email", "email_address")
          .containsEntry("date_of_birth", "dob")
          .containsEntry("phone_number", "mobile");
      assertThat(mappings).allSatisfy(m -> assertThat(m.getConfidence()).isBetween(0.0, 1.0));
    }

    @Test
    @DisplayName("Should never use a source or a target twice")
    void shouldKeepAssignmentsUnique() {
      List<SourceField> sources =
          List.of(
              source("email", "a@example.com", FieldTypeGuess.EMAIL),
              source("mail", "b@example.com", FieldTypeGuess.EMAIL),
              source("email_address", "c@example.com", FieldTypeGuess.EMAIL));
      List<TargetField> targets =
          List.of(
              target("email", FieldTypeGuess.EMAIL, true),
              target("contact_email", FieldTypeGuess.EMAIL, false));

      List<FieldMapping> mappings = engine.map(sources, targets, config);

      assertThat(mappings).extracting(FieldMapping::getTargetName).doesNotHaveDuplicates();
      assertThat(mappings).extracting(FieldMapping::getSourceName).doesNotHaveDuplicates();
      assertThat(mappings.get(0).getTargetName()).isEqualTo("email");
      assertThat(mappings.get(0).getSourceName()).isEqualTo("email");
    }

    @Test
    @DisplayName("Should break ties between equal exact matches by source name")
    void shouldBreakExactTiesBySourceName() {
      List<SourceField> sources =
          List.of(
              source("email", "a@example.com", FieldTypeGuess.EMAIL),
              source("e_mail", "b@example.com", FieldTypeGuess.EMAIL));
      List<TargetField> targets = List.of(target("email", FieldTypeGuess.EMAIL, true));

      List<FieldMapping> mappings = engine.map(sources, targets, config);

      assertThat(mappings).hasSize(1);
      assertThat(mappings.get(0).getSourceName()).isEqualTo("e_mail");
      assertThat(mappings.get(0).getConfidence()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should give identical output for identical input")
    void shouldBeDeterministic() {
      List<FieldMapping> first =
          engine.map(TestFixtures.applicantSources(), TestFixtures.applicantForm(), config);
      List<FieldMapping> second =
          engine.map(
              TestFixtures.applicantSources(),
              TestFixtures.applicantForm(),
              config,
              SimilarityCache.withMaximumSize(50));

      assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Should not modify its inputs")
    void shouldNotMutateInputs() {
      List<SourceField> sources = TestFixtures.applicantSources();
      List<TargetField> targets = TestFixtures.applicantForm();
      List<SourceField> sourcesBefore = new ArrayList<>(sources);
      List<TargetField> targetsBefore = new ArrayList<>(targets);
      MappingConfig configBefore = config.toBuilder().build();

      engine.map(sources, targets, config);

      assertThat(sources).isEqualTo(sourcesBefore);
      assertThat(targets).isEqualTo(targetsBefore);
      assertThat(config).isEqualTo(configBefore);
    }

    @Test
    @DisplayName("Should return nothing for empty sources or targets")
    void shouldHandleEmptyInputs() {
      assertThat(engine.map(List.of(), TestFixtures.applicantForm(), config)).isEmpty();
      assertThat(engine.map(TestFixtures.applicantSources(), List.of(), config)).isEmpty();
      assertThat(engine.map(null, null, config)).isEmpty();
    }

    @Test
    @DisplayName("Should not accept pairs below the assignment threshold")
    void shouldRespectAssignmentThreshold() {
      MappingConfig strict = config.toBuilder().assignmentThreshold(0.7).build();

      List<FieldMapping> mappings =
          engine.map(
              List.of(source("name1", "John Doe", FieldTypeGuess.NAME)),
              List.of(target("fullName", FieldTypeGuess.NAME, true)),
              strict);

      assertThat(mappings).isEmpty();
    }

    @Test
    @DisplayName("Should tolerate unknown source types")
    void shouldTolerateUnknownTypes() {
      List<FieldMapping> mappings =
          engine.map(
              List.of(source("first_name", "John", FieldTypeGuess.UNKNOWN)),
              List.of(target("first_name", FieldTypeGuess.NAME, true)),
              config);

      assertThat(mappings).hasSize(1);
      assertThat(mappings.get(0).getConfidence()).isGreaterThanOrEqualTo(0.95).isLessThan(1.0);
    }
  }

  @Nested
  @DisplayName("Composite confidence")
  class CompositeTests {

    @Test
    @DisplayName("Should floor exact names with disagreeing types at the exact match floor")
    void shouldFloorExactNamesWithOtherTypes() {
      List<FieldMapping> mappings =
          engine.map(
              List.of(source("Email", "see attached", FieldTypeGuess.TEXT)),
              List.of(target("email", FieldTypeGuess.EMAIL, true)),
              config);

      assertThat(mappings).hasSize(1);
      assertThat(mappings.get(0).getConfidence()).isEqualTo(0.95);
    }

    @Test
    @DisplayName("Should report every signal in the strategy breakdown")
    void shouldReportBreakdown() {
      FieldMapping mapping =
          engine
              .map(
                  List.of(source("dob", "12 Jan 1990", FieldTypeGuess.DATE)),
                  List.of(target("date_of_birth", FieldTypeGuess.DATE, false)),
                  config)
              .get(0);

      assertThat(mapping.getStrategyBreakdown())
          .containsKeys(
              SignalScores.LEXICAL,
              SignalScores.TOKEN_OVERLAP,
              SignalScores.TYPE_COMPATIBILITY,
              SignalScores.ALIAS,
              SignalScores.COMPOSITE);
      assertThat(mapping.getStrategyBreakdown().get(SignalScores.COMPOSITE))
          .isEqualTo(mapping.getConfidence());
    }
  }

  @Nested
  @DisplayName("Multi-source merge")
  class MergeTests {

    private final List<SourceField> sources =
        List.of(
            source("first_name", "John", FieldTypeGuess.NAME, "passport"),
            source("first_name", "Johnny", FieldTypeGuess.NAME, "visa"));
    private final List<TargetField> targets =
        List.of(target("first_name", FieldTypeGuess.NAME, true));

    @Test
    @DisplayName("Should keep one mapping per target without merge mode")
    void shouldKeepOneMappingWithoutMerge() {
      List<FieldMapping> mappings = engine.map(sources, targets, config);

      assertThat(mappings).hasSize(1);
      assertThat(mappings.get(0).getSourceDocumentId()).isEqualTo("passport");
    }

    @Test
    @DisplayName("Should keep one mapping per target and document in merge mode")
    void shouldKeepOneMappingPerDocumentInMergeMode() {
      MappingConfig merge = config.toBuilder().multiSourceMerge(true).build();

      List<FieldMapping> mappings = engine.map(sources, targets, merge);

      assertThat(mappings)
          .extracting(FieldMapping::getSourceDocumentId)
          .containsExactly("passport", "visa");
    }
  }
}
