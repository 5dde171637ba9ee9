package dustin.papertrade.domains.statistics.model;

/**
 * 실현 손익 조회 기간
 * Period type for realized profit/loss summaries
 * 
 * - DAY: 기준일 하루
 * - WEEK: 기준일이 속한 주 (월요일 시작)
 * - MONTH: 기준일이 속한 달
 * - YEAR: 기준일이 속한 해
 * - ALL: 전체 기간
 */
public enum PeriodType {
    DAY,
    WEEK,
    MONTH,
    YEAR,
    ALL
}
