package com.alibou.deliverychat.booking;

import com.alibou.deliverychat.booking.dto.*;
import com.alibou.deliverychat.user.IdentityResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/bookings")
public class BookingController {

    private final BookingService   bookingService;
    private final IdentityResolver identityResolver;

    @PostMapping
    public ResponseEntity<BookingResponse> create(@RequestHeader HttpHeaders headers,
                                                  @Valid @RequestBody CreateBookingRequest request) {
        Booking booking = bookingService.create(identityResolver.require(headers),
                request.pickupAddress(), request.deliveryAddress(), request.notes());
        return ResponseEntity.status(HttpStatus.CREATED).body(BookingResponse.from(booking));
    }

    /** Брони вызывающего; {@code active=true} скрывает завершённые */
    @GetMapping
    public List<BookingResponse> list(@RequestHeader HttpHeaders headers,
                                      @RequestParam(defaultValue = "false") boolean active) {
        return bookingService.listFor(identityResolver.require(headers), active).stream()
                .map(BookingResponse::from)
                .toList();
    }

    @GetMapping("/{bookingId}")
    public BookingResponse get(@RequestHeader HttpHeaders headers, @PathVariable long bookingId) {
        return BookingResponse.from(bookingService.get(bookingId, identityResolver.require(headers)));
    }

    /** Администратор назначает (или меняет) курьера */
    @PostMapping("/{bookingId}/assign")
    public BookingResponse assign(@RequestHeader HttpHeaders headers,
                                  @PathVariable long bookingId,
                                  @Valid @RequestBody AssignPartnerRequest request) {
        return BookingResponse.from(
                bookingService.assign(bookingId, request.partnerId(), identityResolver.require(headers)));
    }

    @PostMapping("/{bookingId}/status")
    public BookingResponse updateStatus(@RequestHeader HttpHeaders headers,
                                        @PathVariable long bookingId,
                                        @Valid @RequestBody StatusUpdateRequest request) {
        return BookingResponse.from(bookingService.updateStatus(
                bookingId, request.status(), identityResolver.require(headers), request.note()));
    }

    @PostMapping("/{bookingId}/cancel")
    public BookingResponse cancel(@RequestHeader HttpHeaders headers,
                                  @PathVariable long bookingId,
                                  @Valid @RequestBody(required = false) CancelBookingRequest request) {
        String reason = request == null ? null : request.reason();
        return BookingResponse.from(bookingService.cancel(bookingId, identityResolver.require(headers), reason));
    }

    @GetMapping("/{bookingId}/history")
    public List<StatusLogResponse> history(@RequestHeader HttpHeaders headers, @PathVariable long bookingId) {
        return bookingService.history(bookingId, identityResolver.require(headers)).stream()
                .map(StatusLogResponse::from)
                .toList();
    }
}
