package com.lihtcmate.backend.modules.rentroll.application;

import java.time.LocalDate;

import com.lihtcmate.backend.modules.rentroll.domain.RentRoll;
import com.lihtcmate.backend.modules.rentroll.domain.RentRollSnapshot;

public record ActiveRentRoll(RentRollSnapshot snapshot, RentRoll rentRoll) {

    public LocalDate asOfDate() {
        return rentRoll.getUploadDate();
    }
}
