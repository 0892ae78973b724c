package com.autopilot.mapper;

import com.autopilot.domain.model.BacktestResult;
import com.autopilot.domain.model.CircuitBreakerRecord;
import com.autopilot.domain.model.CycleResult;
import com.autopilot.domain.model.DailyReport;
import com.autopilot.domain.model.OrderAudit;
import com.autopilot.entity.BacktestResultEntity;
import com.autopilot.entity.CircuitBreakerEventEntity;
import com.autopilot.entity.CycleRecordEntity;
import com.autopilot.entity.DailyReportEntity;
import com.autopilot.entity.OrderAuditEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from audit records to their JPA entities. Write-only: nothing in the core reads
 * audit rows back into domain objects.
 */
@Mapper
public interface AuditEntityMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "durationMs", expression = "java(cycleResult.getDuration().toMillis())")
    @Mapping(target = "errors", expression = "java(joinLines(cycleResult.getErrors()))")
    CycleRecordEntity toEntity(CycleResult cycleResult);

    @Mapping(target = "id", ignore = true)
    OrderAuditEntity toEntity(OrderAudit order);

    @Mapping(target = "id", ignore = true)
    CircuitBreakerEventEntity toEntity(CircuitBreakerRecord record);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "symbols", expression = "java(String.join(\",\", result.getSymbols()))")
    BacktestResultEntity toEntity(BacktestResult result);

    @Mapping(target = "id", ignore = true)
    DailyReportEntity toEntity(DailyReport report);

    default String joinLines(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return null;
        }
        String joined = String.join("\n", lines);
        return joined.length() > 4000 ? joined.substring(0, 4000) : joined;
    }
}
