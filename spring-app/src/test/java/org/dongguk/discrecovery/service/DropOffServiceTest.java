package org.dongguk.discrecovery.service;

import org.dongguk.discrecovery.core.exception.CustomException;
import org.dongguk.discrecovery.core.exception.GlobalErrorCode;
import org.dongguk.discrecovery.domain.dropoff.DropOff;
import org.dongguk.discrecovery.domain.dropoff.DropOffErrorCode;
import org.dongguk.discrecovery.domain.recovery.RecoveryErrorCode;
import org.dongguk.discrecovery.domain.recovery.RecoveryEvent;
import org.dongguk.discrecovery.domain.type.NotificationType;
import org.dongguk.discrecovery.domain.type.RecoveryStatus;
import org.dongguk.discrecovery.domain.user.User;
import org.dongguk.discrecovery.dto.request.RecordDropOffRequest;
import org.dongguk.discrecovery.dto.response.DropOffDto;
import org.dongguk.discrecovery.event.NotificationEvent;
import org.dongguk.discrecovery.repository.DropOffRepository;
import org.dongguk.discrecovery.repository.RecoveryEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;

import static org.dongguk.discrecovery.support.TestFixtures.CLOCK;
import static org.dongguk.discrecovery.support.TestFixtures.NOW;
import static org.dongguk.discrecovery.support.TestFixtures.disc;
import static org.dongguk.discrecovery.support.TestFixtures.recoveryEvent;
import static org.dongguk.discrecovery.support.TestFixtures.user;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DropOffServiceTest {
    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x00};

    private RecoveryEventRepository recoveryEventRepository;
    private DropOffRepository dropOffRepository;
    private PhotoStorage photoStorage;
    private ApplicationEventPublisher eventPublisher;
    private DropOffService service;

    private RecoveryEvent event;

    @BeforeEach
    void setUp() {
        recoveryEventRepository = mock(RecoveryEventRepository.class);
        dropOffRepository = mock(DropOffRepository.class);
        photoStorage = mock(PhotoStorage.class);
        eventPublisher = mock(ApplicationEventPublisher.class);
        service = new DropOffService(recoveryEventRepository, dropOffRepository, photoStorage, eventPublisher, CLOCK);
        ReflectionTestUtils.setField(service, "maxPhotoBytes", 1024L);

        User owner = user(1L, "owner");
        User finder = user(2L, "finder");
        event = recoveryEvent(100L, disc(10L, owner, null, null), finder, RecoveryStatus.FOUND);

        when(recoveryEventRepository.findDetailById(100L)).thenReturn(Optional.of(event));
        when(recoveryEventRepository.getReferenceById(100L)).thenReturn(event);
        when(photoStorage.upload(anyString(), any(byte[].class), eq("image/jpeg"))).thenAnswer(invocation ->
                new PhotoStorage.StoredPhoto("https://storage.googleapis.com/test-bucket/" + invocation.getArgument(0),
                        invocation.getArgument(0)));
        when(dropOffRepository.save(any(DropOff.class))).thenAnswer(invocation -> {
            DropOff saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", 300L);
            return saved;
        });
    }

    private RecordDropOffRequest request(MockMultipartFile photo) {
        return new RecordDropOffRequest(photo, 42.3, -71.1, "under the bench at hole 7");
    }

    private MockMultipartFile jpeg() {
        return new MockMultipartFile("photo", "disc.jpg", "image/jpeg", JPEG);
    }

    @Test
    void recordDropOffStoresPhotoAndNotifiesOwner() {
        when(recoveryEventRepository.transition(eq(100L), any(), eq(RecoveryStatus.DROPPED_OFF), eq(NOW))).thenReturn(1);

        DropOffDto result = service.recordDropOff(100L, 2L, request(jpeg()));

        assertEquals(300L, result.id());
        assertEquals(100L, result.recoveryEventId());
        assertTrue(result.storagePath().startsWith("drop-offs/100/"));
        assertTrue(result.storagePath().endsWith(".jpg"));
        assertEquals("under the bench at hole 7", result.locationNotes());
        assertEquals(NOW, result.droppedOffAt());

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publishEvent(captor.capture());
        NotificationEvent notification = assertInstanceOf(NotificationEvent.class, captor.getValue());
        assertEquals(1L, notification.recipientId());
        assertEquals(NotificationType.DISC_DROPPED_OFF, notification.type());
        assertEquals(300L, notification.payload().getDropOffId());
    }

    @Test
    void onlyFinderCanDropOff() {
        CustomException e = assertThrows(CustomException.class,
                () -> service.recordDropOff(100L, 1L, request(jpeg())));

        assertEquals(RecoveryErrorCode.NOT_FINDER, e.getErrorCode());
        verify(photoStorage, never()).upload(anyString(), any(), any());
    }

    @Test
    void dropOffRequiresFoundStatus() {
        ReflectionTestUtils.setField(event, "status", RecoveryStatus.MEETUP_CONFIRMED);

        CustomException e = assertThrows(CustomException.class,
                () -> service.recordDropOff(100L, 2L, request(jpeg())));

        assertEquals(RecoveryErrorCode.INVALID_STATE, e.getErrorCode());
    }

    @Test
    void missingCoordinatesAreRejected() {
        CustomException e = assertThrows(CustomException.class,
                () -> service.recordDropOff(100L, 2L, new RecordDropOffRequest(jpeg(), null, -71.1, null)));

        assertEquals(GlobalErrorCode.MISSING_PARAMETER, e.getErrorCode());
    }

    @Test
    void unsupportedPhotoTypeIsRejected() {
        MockMultipartFile gif = new MockMultipartFile("photo", "disc.gif", "image/gif", new byte[]{1, 2, 3});

        CustomException e = assertThrows(CustomException.class, () -> service.recordDropOff(100L, 2L, request(gif)));

        assertEquals(DropOffErrorCode.INVALID_PHOTO, e.getErrorCode());
        assertEquals("image/gif", e.getDetail());
    }

    @Test
    void oversizedPhotoIsRejected() {
        MockMultipartFile big = new MockMultipartFile("photo", "disc.jpg", "image/jpeg", new byte[2048]);

        CustomException e = assertThrows(CustomException.class, () -> service.recordDropOff(100L, 2L, request(big)));

        assertEquals(DropOffErrorCode.INVALID_PHOTO, e.getErrorCode());
        verify(photoStorage, never()).upload(anyString(), any(), any());
    }

    @Test
    void uploadFailureIsDependencyFailure() {
        doThrow(new IllegalStateException("bucket unavailable"))
                .when(photoStorage).upload(anyString(), any(byte[].class), eq("image/jpeg"));

        CustomException e = assertThrows(CustomException.class,
                () -> service.recordDropOff(100L, 2L, request(jpeg())));

        assertEquals(GlobalErrorCode.DEPENDENCY_FAILURE, e.getErrorCode());
        verify(dropOffRepository, never()).save(any());
    }

    @Test
    void photoIsDeletedWhenStatusGuardFails() {
        when(recoveryEventRepository.transition(eq(100L), any(), eq(RecoveryStatus.DROPPED_OFF), eq(NOW))).thenReturn(0);
        RecoveryEvent moved = recoveryEvent(100L, event.getDisc(), event.getFinder(), RecoveryStatus.MEETUP_PROPOSED);
        when(recoveryEventRepository.findById(100L)).thenReturn(Optional.of(moved));

        CustomException e = assertThrows(CustomException.class,
                () -> service.recordDropOff(100L, 2L, request(jpeg())));

        assertEquals(RecoveryErrorCode.INVALID_STATE, e.getErrorCode());
        assertEquals("MEETUP_PROPOSED", e.getDetail());
        ArgumentCaptor<String> path = ArgumentCaptor.forClass(String.class);
        verify(photoStorage).delete(path.capture());
        assertTrue(path.getValue().startsWith("drop-offs/100/"));
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void statusGuardRunsBeforeDropOffInsert() {
        when(recoveryEventRepository.transition(eq(100L), any(), eq(RecoveryStatus.DROPPED_OFF), eq(NOW))).thenReturn(0);
        RecoveryEvent moved = recoveryEvent(100L, event.getDisc(), event.getFinder(), RecoveryStatus.DROPPED_OFF);
        when(recoveryEventRepository.findById(100L)).thenReturn(Optional.of(moved));

        CustomException e = assertThrows(CustomException.class,
                () -> service.recordDropOff(100L, 2L, request(jpeg())));

        assertEquals(RecoveryErrorCode.INVALID_STATE, e.getErrorCode());
        assertEquals("DROPPED_OFF", e.getDetail());
        verify(dropOffRepository, never()).save(any());
    }

    @Test
    void duplicateDropOffRowIsConflictAndDeletesPhoto() {
        when(recoveryEventRepository.transition(eq(100L), any(), eq(RecoveryStatus.DROPPED_OFF), eq(NOW))).thenReturn(1);
        doThrow(new DataIntegrityViolationException("uk_drop_offs_event"))
                .when(dropOffRepository).save(any(DropOff.class));

        CustomException e = assertThrows(CustomException.class,
                () -> service.recordDropOff(100L, 2L, request(jpeg())));

        assertEquals(GlobalErrorCode.CONFLICT, e.getErrorCode());
        verify(photoStorage).delete(anyString());
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }
}
