package com.gt.practice.evaluation;

import com.gt.practice.exception.InvalidSubmissionShapeException;
import com.gt.practice.model.CanonicalAnswer;
import com.gt.practice.model.ContentItem;
import com.gt.practice.model.EvaluationResult;
import com.gt.practice.model.payload.*;
import com.gt.practice.model.submission.*;
import com.gt.practice.util.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Grades a learner's submission against a content item. Stateless and free of I/O, so a single instance is shared by
 * every session.
 * <p>
 * The canonical answer is returned whether or not the submission was correct. A submission whose type does not fit the
 * item's variant is rejected with {@link InvalidSubmissionShapeException} rather than being graded as wrong.
 */
@Component
public class AnswerEvaluationEngine {

    private static final Logger log = LoggerFactory.getLogger(AnswerEvaluationEngine.class);

    private static final double SLIDER_EPSILON = 1e-9;
    private static final String LIST_SEPARATOR = ", ";

    public EvaluationResult evaluate(ContentItem item, Submission submission, long elapsedMs) {
        if (submission == null) {
            throw new InvalidSubmissionShapeException("No submission given for item " + item.id());
        }
        if (!item.variant().getSubmissionType().isInstance(submission)) {
            throw new InvalidSubmissionShapeException("Item " + item.id() + " of variant " + item.variant().getCode()
                    + " cannot be answered with " + submission.getClass().getSimpleName());
        }

        long timeSpentMs = Math.max(0, elapsedMs);

        EvaluationResult result = switch (item.variant()) {
            case MultipleChoice -> evaluateMultipleChoice((MultipleChoicePayload) item.payload(), (OptionSubmission) submission, timeSpentMs);
            case MultiSelect -> evaluateMultiSelect((MultiSelectPayload) item.payload(), (OptionSetSubmission) submission, timeSpentMs);
            case ClozeDeletion -> evaluateCloze(item.id(), (ClozeDeletionPayload) item.payload(), (BlankSubmission) submission, timeSpentMs);
            case Matching -> evaluateMatching((MatchingPayload) item.payload(), (PairingSubmission) submission, timeSpentMs);
            case Ordering -> evaluateOrdering((OrderingPayload) item.payload(), (SequenceSubmission) submission, timeSpentMs);
            case TrueFalse -> evaluateTrueFalse((TrueFalsePayload) item.payload(), (BooleanSubmission) submission, timeSpentMs);
            case Slider -> evaluateSlider((SliderPayload) item.payload(), (NumericSubmission) submission, timeSpentMs);
            case TextInput -> evaluateTextInput((TextInputPayload) item.payload(), (TextSubmission) submission, timeSpentMs);
            case WordScramble -> evaluateWordScramble((WordScramblePayload) item.payload(), (TextSubmission) submission, timeSpentMs);
            case ErrorDetection -> evaluateErrorDetection(item.id(), (ErrorDetectionPayload) item.payload(), (SpanSelectionSubmission) submission, timeSpentMs);
            case Flashcard -> evaluateFlashcard((FlashcardPayload) item.payload(), (SelfAssessmentSubmission) submission, timeSpentMs);
        };

        log.debug("Evaluated item {} ({}): correct={}, score={}", item.id(), item.variant().getCode(), result.correct(), result.score());

        return result;
    }

    private EvaluationResult evaluateMultipleChoice(MultipleChoicePayload payload, OptionSubmission submission, long timeSpentMs) {
        CanonicalAnswer canonical = new CanonicalAnswer(
                optionText(payload.options(), payload.correctOptionId()),
                new OptionSubmission(payload.correctOptionId()));

        return EvaluationResult.ofMatch(payload.correctOptionId().equals(submission.optionId()), canonical, timeSpentMs);
    }

    private EvaluationResult evaluateMultiSelect(MultiSelectPayload payload, OptionSetSubmission submission, long timeSpentMs) {
        Set<String> expected = payload.correctOptionIds();
        Set<String> selected = submission.optionIds();

        CanonicalAnswer canonical = new CanonicalAnswer(
                payload.options().stream()
                        .filter(option -> expected.contains(option.id()))
                        .map(ChoiceOption::text)
                        .collect(Collectors.joining(LIST_SEPARATOR)),
                new OptionSetSubmission(expected));

        return EvaluationResult.ofScore(jaccard(expected, selected), canonical, timeSpentMs);
    }

    private EvaluationResult evaluateCloze(String itemId, ClozeDeletionPayload payload, BlankSubmission submission, long timeSpentMs) {
        List<ClozeBlank> blanks = payload.blanks();
        List<String> answers = submission.answers();

        if (answers.size() > blanks.size()) {
            throw new InvalidSubmissionShapeException("Item " + itemId + " has " + blanks.size() + " blanks but "
                    + answers.size() + " answers were submitted");
        }

        List<String> correctAnswers = blanks.stream().map(ClozeBlank::correctAnswer).toList();
        CanonicalAnswer canonical = new CanonicalAnswer(String.join(LIST_SEPARATOR, correctAnswers), new BlankSubmission(correctAnswers));

        if (blanks.isEmpty()) {
            return EvaluationResult.ofScore(1.0, canonical, timeSpentMs);
        }

        int hits = 0;
        for (int index = 0; index < blanks.size(); index++) {
            String answer = index < answers.size() ? answers.get(index) : null;
            if (answer != null && blankAccepts(blanks.get(index), answer)) {
                hits++;
            }
        }

        return EvaluationResult.ofScore((double) hits / blanks.size(), canonical, timeSpentMs);
    }

    private EvaluationResult evaluateMatching(MatchingPayload payload, PairingSubmission submission, long timeSpentMs) {
        Map<String, String> expected = new LinkedHashMap<>();
        for (MatchingPair pair : payload.pairs()) {
            expected.put(pair.leftId(), pair.rightId());
        }

        CanonicalAnswer canonical = new CanonicalAnswer(
                payload.pairs().stream()
                        .map(pair -> pair.left() + " = " + pair.right())
                        .collect(Collectors.joining(LIST_SEPARATOR)),
                new PairingSubmission(expected));

        if (expected.isEmpty()) {
            return EvaluationResult.ofScore(1.0, canonical, timeSpentMs);
        }

        long correctPairs = expected.entrySet().stream()
                .filter(entry -> entry.getValue().equals(submission.pairs().get(entry.getKey())))
                .count();

        return EvaluationResult.ofScore((double) correctPairs / expected.size(), canonical, timeSpentMs);
    }

    private EvaluationResult evaluateOrdering(OrderingPayload payload, SequenceSubmission submission, long timeSpentMs) {
        CanonicalAnswer canonical = new CanonicalAnswer(
                payload.correctOrder().stream()
                        .map(id -> optionText(payload.items(), id))
                        .collect(Collectors.joining(LIST_SEPARATOR)),
                new SequenceSubmission(payload.correctOrder()));

        return EvaluationResult.ofMatch(payload.correctOrder().equals(submission.order()), canonical, timeSpentMs);
    }

    private EvaluationResult evaluateTrueFalse(TrueFalsePayload payload, BooleanSubmission submission, long timeSpentMs) {
        CanonicalAnswer canonical = new CanonicalAnswer(
                String.valueOf(payload.correctAnswer()),
                new BooleanSubmission(payload.correctAnswer()));

        return EvaluationResult.ofMatch(payload.correctAnswer() == submission.value(), canonical, timeSpentMs);
    }

    private EvaluationResult evaluateSlider(SliderPayload payload, NumericSubmission submission, long timeSpentMs) {
        String display = payload.unit() == null || payload.unit().isBlank()
                ? formatNumber(payload.target())
                : formatNumber(payload.target()) + " " + payload.unit();
        CanonicalAnswer canonical = new CanonicalAnswer(display, new NumericSubmission(payload.target()));

        boolean withinTolerance = !Double.isNaN(submission.value())
                && Math.abs(submission.value() - payload.target()) <= payload.tolerance() + SLIDER_EPSILON;

        return EvaluationResult.ofMatch(withinTolerance, canonical, timeSpentMs);
    }

    private EvaluationResult evaluateTextInput(TextInputPayload payload, TextSubmission submission, long timeSpentMs) {
        String primary = payload.acceptedAnswers().get(0);
        CanonicalAnswer canonical = new CanonicalAnswer(primary, new TextSubmission(primary));

        boolean accepted = payload.acceptedAnswers().stream()
                .anyMatch(answer -> TextNormalizer.matches(submission.text(), answer, payload.caseSensitive()));

        return EvaluationResult.ofMatch(accepted, canonical, timeSpentMs);
    }

    private EvaluationResult evaluateWordScramble(WordScramblePayload payload, TextSubmission submission, long timeSpentMs) {
        CanonicalAnswer canonical = new CanonicalAnswer(payload.targetWord(), new TextSubmission(payload.targetWord()));

        return EvaluationResult.ofMatch(TextNormalizer.matches(submission.text(), payload.targetWord(), false), canonical, timeSpentMs);
    }

    private EvaluationResult evaluateErrorDetection(String itemId, ErrorDetectionPayload payload, SpanSelectionSubmission submission, long timeSpentMs) {
        Set<Integer> truth = payload.errorIndices();
        Set<Integer> selected = submission.spanIndices();

        for (Integer index : selected) {
            if (index == null || index < 0 || index >= payload.spans().size()) {
                throw new InvalidSubmissionShapeException("Item " + itemId + " has no span at index " + index);
            }
        }

        CanonicalAnswer canonical = new CanonicalAnswer(
                new TreeSet<>(truth).stream()
                        .map(index -> payload.spans().get(index))
                        .collect(Collectors.joining(LIST_SEPARATOR)),
                new SpanSelectionSubmission(truth));

        if (truth.isEmpty() && selected.isEmpty()) {
            return EvaluationResult.ofScore(1.0, canonical, timeSpentMs);
        }

        long truePositives = selected.stream().filter(truth::contains).count();
        double score = truePositives == 0 ? 0 : (2.0 * truePositives) / (truth.size() + selected.size());

        return new EvaluationResult(truth.equals(selected), score, canonical, timeSpentMs);
    }

    private EvaluationResult evaluateFlashcard(FlashcardPayload payload, SelfAssessmentSubmission submission, long timeSpentMs) {
        CanonicalAnswer canonical = new CanonicalAnswer(payload.back(), new SelfAssessmentSubmission(true));

        return EvaluationResult.ofMatch(submission.known(), canonical, timeSpentMs);
    }

    private static boolean blankAccepts(ClozeBlank blank, String answer) {
        if (TextNormalizer.matches(answer, blank.correctAnswer(), false)) {
            return true;
        }
        return blank.alternatives().stream().anyMatch(alternative -> TextNormalizer.matches(answer, alternative, false));
    }

    // |A ∩ B| / |A ∪ B|, with two empty sets counting as identical
    static double jaccard(Set<String> expected, Set<String> selected) {
        if (expected.isEmpty() && selected.isEmpty()) {
            return 1.0;
        }

        Set<String> union = new HashSet<>(expected);
        union.addAll(selected);

        long intersection = selected.stream().filter(expected::contains).count();

        return (double) intersection / union.size();
    }

    private static String optionText(List<ChoiceOption> options, String optionId) {
        return options.stream()
                .filter(option -> option.id().equals(optionId))
                .map(ChoiceOption::text)
                .findFirst()
                .orElse(optionId);
    }

    private static String formatNumber(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
