package com.codeintel.dto.mapper;

import com.codeintel.dto.response.CodeDetailDto;
import com.codeintel.dto.response.CodeDetailDto.OptionalFields;
import com.codeintel.dto.response.CodeSummaryDto;
import com.codeintel.model.code.CodeRecord;
import com.codeintel.model.code.PaymentSet;
import com.codeintel.model.code.RateMetadata;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper for converting code records to DTOs.
 */
@Component
public class CodeMapper {

    public CodeSummaryDto toSummaryDto(CodeRecord record) {
        if (record == null) {
            return null;
        }
        return new CodeSummaryDto(
            record.code(),
            record.description(),
            record.category(),
            record.type().getValue(),
            record.labels()
        );
    }

    public List<CodeSummaryDto> toSummaryDtoList(List<CodeRecord> records) {
        return records.stream().map(this::toSummaryDto).toList();
    }

    public CodeDetailDto toDetailDto(CodeRecord record, PaymentSet payments) {
        if (record == null) {
            return null;
        }
        RateMetadata rates = record.rateMetadata();
        return new CodeDetailDto(
            record.code(),
            record.description(),
            record.category(),
            record.type().getValue(),
            record.labels(),
            payments,
            new OptionalFields(
                null,
                rates.apc(),
                rates.si(),
                rates.rank(),
                rates.modifiers(),
                rates.effectiveDate()
            ),
            record.rawMetadata()
        );
    }
}
