package peopleops.compensation.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.UUID;

/**
 * Keeper test answers submitted by a manager through the Slack form.
 *
 * <p>
 * One row per keeper test job: {@code job_id} is unique, so a repeated submission of the same form is recognised and
 * not stored twice.
 */
@Entity
@Table(
        name = "keeper_test_feedback",
        uniqueConstraints = {@UniqueConstraint(
                name = "uq_keeper_test_feedback_job_id",
                columnNames = "job_id")})
public class KeeperTestFeedback extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "created",
            nullable = false,
            updatable = false)
    public Instant created;

    @Column(
            name = "job_id",
            nullable = false)
    public UUID jobId;

    @Column(
            name = "employee_id",
            nullable = false)
    public String employeeId;

    @Column(
            name = "manager_id",
            nullable = false)
    public String managerId;

    @Column(
            name = "title",
            nullable = false)
    public String title;

    @Column(
            name = "would_you_try_to_keep_them")
    public String wouldYouTryToKeepThem;

    @Column(
            name = "what_makes_them_valuable",
            length = 4000)
    public String whatMakesThemValuable;

    @Column(
            name = "driver_or_passenger")
    @Enumerated(EnumType.STRING)
    public DriverOrPassenger driverOrPassenger;

    @Column(
            name = "proactive_today")
    public boolean proactiveToday;

    @Column(
            name = "optimistic_by_default")
    public boolean optimisticByDefault;

    @Column(
            name = "areas_to_watch",
            length = 4000)
    public String areasToWatch;

    /** Only asked for probation check-ins, null otherwise. */
    @Column(
            name = "recommendation")
    @Enumerated(EnumType.STRING)
    public Recommendation recommendation;

    @Column(
            name = "shared_with_team_member")
    public boolean sharedWithTeamMember;

    public enum DriverOrPassenger {
        DRIVER, PASSENGER
    }

    public enum Recommendation {
        STRONG_HIRE_ON_TRACK_TO_PASS_PROBATION, AVERAGE_HIRE_NEED_TO_SEE_IMPROVEMENTS, NOT_A_FIT_NEEDS_ESCALATING
    }

    /**
     * Creates an unsaved feedback row for a keeper test job. Callers fill in the answers and persist.
     */
    public static KeeperTestFeedback forJob(UUID jobId, String employeeId, String managerId, String title) {
        KeeperTestFeedback feedback = new KeeperTestFeedback();
        feedback.id = UUID.randomUUID();
        feedback.created = Instant.now();
        feedback.jobId = jobId;
        feedback.employeeId = employeeId;
        feedback.managerId = managerId;
        feedback.title = title;
        return feedback;
    }

    public static KeeperTestFeedback findByJobId(UUID jobId) {
        if (jobId == null) {
            return null;
        }
        return find("jobId", jobId).firstResult();
    }
}
