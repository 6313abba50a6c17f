package uk.gegc.examengine.features.session.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import uk.gegc.examengine.features.scoring.application.CategoryScore;
import uk.gegc.examengine.features.session.api.dto.AnswerDto;
import uk.gegc.examengine.features.session.api.dto.CategoryScoreDto;
import uk.gegc.examengine.features.session.api.dto.SavedAnswerDto;
import uk.gegc.examengine.features.session.domain.model.ExamAnswer;

import java.util.List;

/**
 * MapStruct mapper for answer rows and category scores.
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface ExamAnswerMapper {

    @Mapping(target = "answerId", source = "id")
    AnswerDto toDto(ExamAnswer answer);

    SavedAnswerDto toSavedDto(ExamAnswer answer);

    CategoryScoreDto toCategoryDto(CategoryScore categoryScore);

    List<CategoryScoreDto> toCategoryDtos(List<CategoryScore> categoryScores);
}
