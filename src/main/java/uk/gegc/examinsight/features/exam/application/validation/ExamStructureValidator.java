package uk.gegc.examinsight.features.exam.application.validation;

import org.springframework.stereotype.Component;
import uk.gegc.examinsight.features.exam.api.dto.ExamQuestionRequest;
import uk.gegc.examinsight.features.exam.domain.model.ExamQuestion;
import uk.gegc.examinsight.features.exam.domain.model.QuestionDifficulty;
import uk.gegc.examinsight.shared.exception.ValidationException;

import java.util.*;

/**
 * Checks that generated questions are structurally complete before an exam is stored.
 * Question quality is not judged here, only shape: ids, text, four labelled options and
 * an answer key that points at one of them. Violations are aggregated into one message.
 */
@Component
public class ExamStructureValidator {

    public static final int REQUIRED_OPTION_COUNT = 4;
    public static final String DEFAULT_TOPIC = "Unknown";
    public static final QuestionDifficulty DEFAULT_DIFFICULTY = QuestionDifficulty.MEDIUM;

    /**
     * Validates and normalises the generated questions.
     *
     * @return immutable question records in the submitted order
     * @throws ValidationException listing every violation found
     */
    public List<ExamQuestion> validateAndNormalize(List<ExamQuestionRequest> questions) {
        if (questions == null || questions.isEmpty()) {
            throw new ValidationException("An exam must contain at least one question");
        }

        List<String> errors = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        List<ExamQuestion> normalized = new ArrayList<>(questions.size());

        for (int i = 0; i < questions.size(); i++) {
            ExamQuestionRequest question = questions.get(i);
            String label = "Question #" + (i + 1);
            if (question == null) {
                errors.add(label + " is missing");
                continue;
            }
            validateQuestion(question, label, seenIds, errors);
            normalized.add(normalize(question));
        }

        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid exam structure: " + String.join("; ", errors));
        }
        return List.copyOf(normalized);
    }

    private void validateQuestion(ExamQuestionRequest question, String label, Set<String> seenIds, List<String> errors) {
        if (isBlank(question.id())) {
            errors.add(label + " has no id");
        } else if (!seenIds.add(question.id())) {
            errors.add(label + " reuses id '" + question.id() + "'");
        }
        if (isBlank(question.text())) {
            errors.add(label + " has no text");
        }

        Map<String, String> options = question.options();
        if (options == null || options.size() != REQUIRED_OPTION_COUNT) {
            errors.add(label + " must have exactly " + REQUIRED_OPTION_COUNT + " options");
        } else if (options.entrySet().stream().anyMatch(e -> isBlank(e.getKey()) || isBlank(e.getValue()))) {
            errors.add(label + " has a blank option");
        }

        if (isBlank(question.correctAnswer())) {
            errors.add(label + " has no correct answer");
        } else if (options != null && !options.containsKey(question.correctAnswer())) {
            errors.add(label + " has correct answer '" + question.correctAnswer() + "' which is not one of its options");
        }
    }

    private ExamQuestion normalize(ExamQuestionRequest question) {
        Map<String, String> options = question.options() == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(question.options()));
        return new ExamQuestion(
                question.id(),
                question.text(),
                options,
                question.correctAnswer(),
                question.explanation(),
                isBlank(question.topic()) ? DEFAULT_TOPIC : question.topic().trim(),
                question.difficulty() != null ? question.difficulty() : DEFAULT_DIFFICULTY,
                question.sourceReference()
        );
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
