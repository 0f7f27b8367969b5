package io.github.riemr.autoschedule.infrastructure.persistence.entity;

import io.github.riemr.autoschedule.domain.model.RsvpStatus;

import java.io.Serializable;
import java.time.LocalDateTime;

public class Attendance implements Serializable {
    private Long id;
    private Long occurrenceId;
    private Long personAliasId;
    private RsvpStatus rsvp;
    private Boolean requestedToAttend;
    private Boolean scheduledToAttend;
    private Boolean didAttend; // null until the occurrence has happened
    private Long scheduledByPersonAliasId;
    private LocalDateTime rsvpDateTime;
    private LocalDateTime createdAt;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getOccurrenceId() { return occurrenceId; }
    public void setOccurrenceId(Long occurrenceId) { this.occurrenceId = occurrenceId; }
    public Long getPersonAliasId() { return personAliasId; }
    public void setPersonAliasId(Long personAliasId) { this.personAliasId = personAliasId; }
    public RsvpStatus getRsvp() { return rsvp; }
    public void setRsvp(RsvpStatus rsvp) { this.rsvp = rsvp; }
    public Boolean getRequestedToAttend() { return requestedToAttend; }
    public void setRequestedToAttend(Boolean requestedToAttend) { this.requestedToAttend = requestedToAttend; }
    public Boolean getScheduledToAttend() { return scheduledToAttend; }
    public void setScheduledToAttend(Boolean scheduledToAttend) { this.scheduledToAttend = scheduledToAttend; }
    public Boolean getDidAttend() { return didAttend; }
    public void setDidAttend(Boolean didAttend) { this.didAttend = didAttend; }
    public Long getScheduledByPersonAliasId() { return scheduledByPersonAliasId; }
    public void setScheduledByPersonAliasId(Long scheduledByPersonAliasId) { this.scheduledByPersonAliasId = scheduledByPersonAliasId; }
    public LocalDateTime getRsvpDateTime() { return rsvpDateTime; }
    public void setRsvpDateTime(LocalDateTime rsvpDateTime) { this.rsvpDateTime = rsvpDateTime; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
}
