package org.hopkinson.utils.dataonly;

import java.util.List;

/**
 * Заключение о пригодности испытания.
 * @param validity итоговый статус
 * @param forceEquilibrium достигнуто ли равновесие сил
 * @param constantStrainRate выдержана ли постоянная скорость деформации
 * @param notes человекочитаемые заметки
 * @param criteria выполненные критерии
 */
public record ValidityAssessment(TestValidity validity,
                                 Achievement forceEquilibrium,
                                 Achievement constantStrainRate,
                                 String notes,
                                 List<String> criteria) {

    public enum TestValidity { VALID, QUESTIONABLE, INVALID }

    public enum Achievement { ACHIEVED, PARTIALLY_ACHIEVED, NOT_ACHIEVED }

    public ValidityAssessment {
        criteria = List.copyOf(criteria);
    }
}
