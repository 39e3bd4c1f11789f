package com.flagship.restaurant_pos.shift;

import com.flagship.restaurant_pos.access.ActorContext;
import com.flagship.restaurant_pos.shift.dto.EndShiftRequest;
import com.flagship.restaurant_pos.shift.dto.ShiftResponse;
import com.flagship.restaurant_pos.shift.dto.ShiftSummary;
import com.flagship.restaurant_pos.shift.dto.StartShiftRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/shifts")
@RequiredArgsConstructor
public class ShiftController {

    private final ShiftService shiftService;

    @PostMapping("/start")
    public ResponseEntity<ShiftResponse> startShift(@Valid @RequestBody StartShiftRequest request,
                                                    @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(shiftService.startShift(request.getOpeningCash(), actor));
    }

    @PostMapping("/end")
    public ShiftResponse endShift(@Valid @RequestBody EndShiftRequest request,
                                  @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return shiftService.endShift(request.getClosingCash(), actor);
    }

    @GetMapping("/current")
    public ShiftSummary currentSummary(@RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return shiftService.currentSummary(actor);
    }
}
