package org.dongguk.discrecovery.domain.type;

public enum MeetupStatus {
    PENDING,
    ACCEPTED,
    DECLINED
}
