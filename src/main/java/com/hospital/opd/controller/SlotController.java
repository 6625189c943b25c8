package com.hospital.opd.controller;

import com.hospital.opd.component.ConcurrencyController;
import com.hospital.opd.component.OperationRegistry;
import com.hospital.opd.dto.QueueEntry;
import com.hospital.opd.dto.SlotCapacityRequest;
import com.hospital.opd.dto.SlotRequest;
import com.hospital.opd.dto.SlotSummary;
import com.hospital.opd.entity.Slot;
import com.hospital.opd.service.SlotCapacityManager;
import com.hospital.opd.service.SlotService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/slots")
public class SlotController {

    private final SlotService slotService;
    private final ConcurrencyController concurrency;

    public SlotController(SlotService slotService, ConcurrencyController concurrency) {
        this.slotService = slotService;
        this.concurrency = concurrency;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SlotSummary open(@RequestBody SlotRequest request) {
        return slotService.openSlot(request);
    }

    @GetMapping("/{slotId}")
    public SlotSummary get(@PathVariable String slotId) {
        return slotService.getSlot(slotId);
    }

    @GetMapping("/{slotId}/availability")
    public SlotCapacityManager.Availability availability(@PathVariable String slotId,
                                                         @RequestParam(defaultValue = "false") boolean emergency) {
        return slotService.availability(slotId, emergency);
    }

    @GetMapping("/{slotId}/queue")
    public List<QueueEntry> queue(@PathVariable String slotId) {
        return slotService.slotQueue(slotId);
    }

    @PutMapping("/{slotId}/status")
    public SlotSummary status(@PathVariable String slotId, @RequestParam Slot.Status status) {
        return slotService.changeSlotStatus(slotId, status);
    }

    @PutMapping("/{slotId}/capacity")
    public SlotSummary capacity(@PathVariable String slotId, @RequestBody SlotCapacityRequest request) {
        return slotService.changeSlotCapacity(slotId, request);
    }

    @GetMapping("/operations")
    public List<OperationRegistry.InFlightOperation> inFlight() {
        return concurrency.inFlightOperations();
    }
}
