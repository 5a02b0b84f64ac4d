package com.mintledger.mint.schema;

import com.mintledger.common.IpfsIdentifiers;
import com.mintledger.domain.MintRecord;
import com.mintledger.mint.error.FieldViolation;
import com.mintledger.mint.error.MintValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Validates a MintRecord against the constraints declared on the document.
 * Reports one violation per field; a "required" violation wins over a format violation on the same field.
 */
@Component
@RequiredArgsConstructor
public class MintRecordValidator {

    static final String IMAGE_URL_FIELD = "imageUrl";

    private final Validator validator;

    /**
     * @return all violations, sorted by field path; empty when the record is valid
     */
    public List<FieldViolation> check(MintRecord record) {
        Set<ConstraintViolation<MintRecord>> violations = validator.validate(record);
        Map<String, FieldViolation> byField = new TreeMap<>();
        violations.stream()
                .sorted(Comparator.<ConstraintViolation<MintRecord>, Boolean>comparing(MintRecordValidator::isRequiredConstraint).reversed())
                .forEach(v -> {
                    String field = v.getPropertyPath().toString();
                    byField.putIfAbsent(field, new FieldViolation(field, v.getMessage()));
                });
        if (!byField.containsKey(IMAGE_URL_FIELD) && !imageMatchesCid(record)) {
            byField.put(IMAGE_URL_FIELD, new FieldViolation(IMAGE_URL_FIELD, "Image URL does not reference the record's IPFS CID"));
        }
        return new ArrayList<>(byField.values());
    }

    /**
     * @throws MintValidationException listing every failing field
     */
    public void validate(MintRecord record) {
        List<FieldViolation> violations = check(record);
        if (!violations.isEmpty()) {
            throw new MintValidationException(violations);
        }
    }

    private static boolean imageMatchesCid(MintRecord record) {
        String imageUrl = record.getImageUrl();
        if (imageUrl == null || imageUrl.isEmpty() || !IpfsIdentifiers.isCid(record.getIpfsCid())) {
            return true;
        }
        return imageUrl.endsWith("/ipfs/" + record.getIpfsCid());
    }

    private static boolean isRequiredConstraint(ConstraintViolation<?> violation) {
        Class<?> type = violation.getConstraintDescriptor().getAnnotation().annotationType();
        return type == NotBlank.class || type == NotNull.class;
    }
}
