package com.opentoclose.client.service.validation;

/**
 * Payload and listing validators of every Open To Close resource.
 */
public final class ResourceRules {

    public static final ResourceValidator CONTACTS = ResourceValidator.forResource("Contact")
            .requireAnyOnCreate("email", "phone", "first_name", "last_name")
            .rejectOnCreate("name", "The 'name' field is not supported by the API. "
                                    + "Use 'first_name' and 'last_name' fields instead.")
            .email("email")
            .nonBlankString("phone", "first_name", "last_name")
            .build();

    public static final ResourceValidator AGENTS = ResourceValidator.forResource("Agent")
            .requireAnyOnCreate("email", "phone", "name", "first_name", "last_name")
            .email("email")
            .nonBlankString("phone", "name", "first_name", "last_name", "license_number")
            .build();

    public static final ResourceValidator TAGS = ResourceValidator.forResource("Tag")
            .requireAllOnCreate("name")
            .nonBlankString("name", "category")
            .hexColor("color")
            .string("description")
            .bool("is_active")
            .nonNegativeInteger("sort_order")
            .build();

    public static final ResourceValidator PROPERTY_NOTES = ResourceValidator.forResource("Note")
            .requireAllOnCreate("content")
            .nonBlankString("content", "author", "priority", "visibility")
            .bool("is_private")
            .stringList("tags")
            .build();

    public static final ResourceValidator PROPERTY_DOCUMENTS = ResourceValidator.forResource("Document")
            .requireAllOnCreate("name")
            .nonBlankString("name", "type")
            .httpUrl("url")
            .nonNegativeInteger("file_size")
            .string("description")
            .build();

    public static final ResourceValidator PROPERTY_TASKS = ResourceValidator.forResource("Task")
            .requireAllOnCreate("title")
            .nonBlankString("title", "status", "priority", "assignee", "due_date")
            .positiveInteger("assignee_id")
            .string("description")
            .bool("is_completed")
            .build();

    public static final ResourceValidator PROPERTY_EMAILS = ResourceValidator.forResource("Email")
            .nonBlankString("subject", "status", "priority")
            .string("body")
            .email("recipient", "sender")
            .emailList("recipients")
            .build();

    public static final ResourceValidator PROPERTY_CONTACTS = ResourceValidator.forResource("Property contact")
            .requireAllOnCreate("contact_id")
            .positiveInteger("contact_id")
            .ignoredByApi("role", "is_primary", "priority", "notes")
            .build();

    public static final ResourceValidator TEAMS = ResourceValidator.forResource("Team").build();

    public static final ResourceValidator USERS = ResourceValidator.forResource("User").build();

    public static final ResourceValidator PROPERTIES = ResourceValidator.forResource("Property").build();

    public static final ListParamsValidator STANDARD_LIST = ListParamsValidator.standard();

    public static final ListParamsValidator TAGS_LIST = ListParamsValidator.withStringFilters("category")
            .andBooleanFilters("is_active");

    public static final ListParamsValidator NOTES_LIST = ListParamsValidator.withStringFilters("author", "priority");

    public static final ListParamsValidator DOCUMENTS_LIST = ListParamsValidator.withStringFilters("type");

    public static final ListParamsValidator TASKS_LIST = ListParamsValidator.withStringFilters("status", "priority");

    public static final ListParamsValidator EMAILS_LIST = ListParamsValidator.withStringFilters("status");

    private ResourceRules() {
    }
}
