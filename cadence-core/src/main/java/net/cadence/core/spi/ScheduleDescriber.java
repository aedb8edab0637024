package net.cadence.core.spi;

import net.cadence.core.model.Schedule;

/** 편집기/목록 화면용 사람이 읽는 스케줄 설명 */
public interface ScheduleDescriber {
    String describe(Schedule schedule);
}
