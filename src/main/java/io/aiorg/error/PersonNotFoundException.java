package io.aiorg.error;

public class PersonNotFoundException extends AiorgException {
    public PersonNotFoundException(String message) {
        super(ErrorCode.PERSON_NOT_FOUND, message);
    }
}
