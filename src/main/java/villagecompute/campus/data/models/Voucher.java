package villagecompute.campus.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

/**
 * Monthly fee obligation issued to a student.
 *
 * <p>
 * {@code due_year} and {@code due_month} duplicate the month of {@code due_date} so the database can enforce one voucher
 * per student per month. {@link #issue} is the only way the generation job creates rows and keeps both in sync.
 *
 * <h3>Schema Mapping:</h3>
 * <ul>
 * <li>id (BIGSERIAL, PK)</li>
 * <li>student_id (BIGINT) - Reference to users</li>
 * <li>fee_amount (NUMERIC), description (TEXT)</li>
 * <li>due_date (DATE), promise_date (INT)</li>
 * <li>due_year, due_month (INT) - Unique with student_id</li>
 * <li>status (TEXT) - PENDING, SUBMITTED, APPROVED, REJECTED</li>
 * <li>submitted_at, approved_at (TIMESTAMPTZ), approved_by (BIGINT), submission_file, remarks (TEXT)</li>
 * </ul>
 *
 * <h3>Status Lifecycle:</h3> {@code PENDING → SUBMITTED → APPROVED}, or {@code SUBMITTED → REJECTED} after which the
 * student resubmits. Only PENDING vouchers count as unpaid for the overdue and auto-block jobs.
 */
@Entity
@Table(
        name = "vouchers",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_vouchers_student_month",
                columnNames = {"student_id", "due_year", "due_month"}))
@NamedQuery(
        name = Voucher.QUERY_FIND_PENDING_DUE_BEFORE,
        query = "FROM Voucher WHERE status = :status AND dueDate < :date ORDER BY dueDate, id")
@NamedQuery(
        name = Voucher.QUERY_FIND_PENDING_DUE_ON_OR_BEFORE,
        query = "FROM Voucher WHERE status = :status AND dueDate <= :date ORDER BY dueDate, id")
public class Voucher extends PanacheEntityBase {

    public static final String QUERY_FIND_PENDING_DUE_BEFORE = "Voucher.findPendingDueBefore";
    public static final String QUERY_FIND_PENDING_DUE_ON_OR_BEFORE = "Voucher.findPendingDueOnOrBefore";

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "student_id",
            nullable = false)
    public Long studentId;

    @Column(
            name = "fee_amount",
            nullable = false,
            precision = 12,
            scale = 2)
    public BigDecimal feeAmount;

    @Column(
            nullable = false)
    public String description;

    @Column(
            name = "due_date",
            nullable = false)
    public LocalDate dueDate;

    @Column(
            name = "promise_date")
    public Integer promiseDate;

    @Column(
            name = "due_year",
            nullable = false)
    public int dueYear;

    @Column(
            name = "due_month",
            nullable = false)
    public int dueMonth;

    @Enumerated(EnumType.STRING)
    @Column(
            nullable = false,
            length = 20)
    public VoucherStatus status = VoucherStatus.PENDING;

    @Column(
            name = "submitted_at")
    public Instant submittedAt;

    @Column(
            name = "approved_at")
    public Instant approvedAt;

    @Column(
            name = "approved_by")
    public Long approvedBy;

    @Column(
            name = "submission_file")
    public String submissionFile;

    @Column(
            columnDefinition = "TEXT")
    public String remarks;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    public enum VoucherStatus {
        PENDING, SUBMITTED, APPROVED, REJECTED
    }

    /**
     * Returns true if the student already has a voucher due in the given month, whatever its status.
     */
    public static boolean existsForMonth(Long studentId, YearMonth month) {
        return count("studentId = ?1 AND dueYear = ?2 AND dueMonth = ?3", studentId, month.getYear(),
                month.getMonthValue()) > 0;
    }

    /**
     * Pending vouchers whose due date is strictly before {@code date}.
     */
    public static List<Voucher> findPendingDueBefore(LocalDate date) {
        return find("#" + QUERY_FIND_PENDING_DUE_BEFORE,
                Parameters.with("status", VoucherStatus.PENDING).and("date", date)).list();
    }

    /**
     * Pending vouchers whose due date is on or before {@code date}.
     */
    public static List<Voucher> findPendingDueOnOrBefore(LocalDate date) {
        return find("#" + QUERY_FIND_PENDING_DUE_ON_OR_BEFORE,
                Parameters.with("status", VoucherStatus.PENDING).and("date", date)).list();
    }

    /**
     * Creates and flushes a pending voucher. Must run inside a transaction; a duplicate month fails on flush.
     */
    public static Voucher issue(Long studentId, BigDecimal feeAmount, String description, LocalDate dueDate,
            Integer promiseDate, Instant createdAt) {
        Voucher voucher = new Voucher();
        voucher.studentId = studentId;
        voucher.feeAmount = feeAmount;
        voucher.description = description;
        voucher.dueDate = dueDate;
        voucher.promiseDate = promiseDate;
        voucher.dueYear = dueDate.getYear();
        voucher.dueMonth = dueDate.getMonthValue();
        voucher.status = VoucherStatus.PENDING;
        voucher.createdAt = createdAt;
        voucher.persistAndFlush();
        return voucher;
    }
}
