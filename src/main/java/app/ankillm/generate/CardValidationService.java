package app.ankillm.generate;

import app.ankillm.domain.CardCandidate;
import app.ankillm.domain.PromptTemplate;
import app.ankillm.domain.ValidatedCard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class CardValidationService {

    private static final Logger log = LoggerFactory.getLogger(CardValidationService.class);

    private final HtmlSanitizer sanitizer;
    private final FieldMapper fieldMapper;
    private final DuplicateChecker duplicateChecker;

    public CardValidationService(HtmlSanitizer sanitizer, FieldMapper fieldMapper, DuplicateChecker duplicateChecker) {
        this.sanitizer = sanitizer;
        this.fieldMapper = fieldMapper;
        this.duplicateChecker = duplicateChecker;
    }

    /**
     * Sanitizes, maps and duplicate-annotates candidates. Output order follows input order.
     *
     * @param firstFieldName the store's unique field of the note type
     */
    public List<ValidatedCard> validate(List<CardCandidate> candidates, PromptTemplate template, String firstFieldName) {
        List<ValidatedCard> validated = new ArrayList<>(candidates.size());
        for (CardCandidate candidate : candidates) {
            CardCandidate sanitized = candidate.withFields(sanitizer.sanitizeFields(candidate.fields()));
            Map<String, String> ankiFields = fieldMapper.mapFields(sanitized, template.fieldMap());

            String firstFieldValue = ankiFields.get(firstFieldName);
            boolean duplicate = false;
            if (firstFieldValue == null || firstFieldValue.isBlank()) {
                log.warn("Card is missing first field, skipping duplicate check rowIndex={} field={}",
                        candidate.rowIndex(), firstFieldName);
            } else {
                duplicate = duplicateChecker.isDuplicate(firstFieldValue, template.noteType(), template.deck());
            }
            validated.add(new ValidatedCard(sanitized, duplicate, ankiFields));
        }
        long duplicates = validated.stream().filter(ValidatedCard::duplicate).count();
        log.info("Validated cards count={} duplicates={}", validated.size(), duplicates);
        return validated;
    }
}
