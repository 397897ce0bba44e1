package com.example.profile.model;

/** 連絡先の一括更新用。null の項目はクリアされる。 */
public record ContactDetails(String firstName, String lastName, String email, String phoneNumber) {}
